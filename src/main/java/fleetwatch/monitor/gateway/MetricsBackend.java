package fleetwatch.monitor.gateway;

import fleetwatch.monitor.error.InstanceNotFoundException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.model.Sample;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Cloud telemetry backend returning per-instance statistics for one metric.
 */
public interface MetricsBackend {

    /**
     * Fetch statistics for one metric of one instance over {@code [start, end)}.
     *
     * @param namespace  metric namespace, e.g. AWS/EC2
     * @param metricName metric name, e.g. CPUUtilization
     * @param instanceId instance dimension value
     * @param start      window start (inclusive)
     * @param end        window end
     * @param period     aggregation period
     * @param statistic  statistic name, e.g. Average
     * @return samples ordered by timestamp
     * @throws TransientBackendException on throttling or temporary unavailability
     * @throws InstanceNotFoundException when the instance is unknown to the backend
     */
    List<Sample> fetchMetricStatistics(String namespace, String metricName, String instanceId,
            Instant start, Instant end, Duration period, String statistic)
            throws TransientBackendException, InstanceNotFoundException;
}
