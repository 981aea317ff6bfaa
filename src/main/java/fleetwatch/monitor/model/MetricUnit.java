package fleetwatch.monitor.model;

import java.util.Locale;

/**
 * Unit a tracked metric is reported in.
 * Idle thresholds are only meaningful for PERCENT metrics (0-100 scale).
 */
public enum MetricUnit {
    /** Utilization on a 0-100 scale */
    PERCENT,
    /** Byte counts (network, disk) */
    BYTES,
    /** Operation counts */
    COUNT;

    public static MetricUnit parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric unit is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
