package fleetwatch.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One statistical datapoint of a metric for one instance.
 */
public record Sample(String instanceId, double value, Instant timestamp) {

    public Sample {
        Objects.requireNonNull(instanceId, "instanceId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
