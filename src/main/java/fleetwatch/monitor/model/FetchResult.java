package fleetwatch.monitor.model;

import java.util.List;
import java.util.Objects;

/**
 * Typed result of {@code MetricsClient.fetch}. Failures never escape as exceptions.
 */
public record FetchResult(FetchStatus status, List<Sample> samples, String reason) {

    public FetchResult {
        Objects.requireNonNull(status, "status is required");
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    public static FetchResult ok(List<Sample> samples) {
        return new FetchResult(FetchStatus.OK, samples, null);
    }

    public static FetchResult notFound(String reason) {
        return new FetchResult(FetchStatus.NOT_FOUND, List.of(), reason);
    }

    public static FetchResult retriesExhausted(String reason) {
        return new FetchResult(FetchStatus.RETRIES_EXHAUSTED, List.of(), reason);
    }

    public static FetchResult failed(String reason) {
        return new FetchResult(FetchStatus.FAILED, List.of(), reason);
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }
}
