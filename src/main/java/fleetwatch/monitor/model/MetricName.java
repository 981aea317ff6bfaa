package fleetwatch.monitor.model;

import java.util.Objects;

/**
 * Two-part CloudWatch metric identifier plus the unit it is reported in.
 */
public record MetricName(String namespace, String name, MetricUnit unit) {

    public MetricName {
        Objects.requireNonNull(namespace, "namespace is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(unit, "unit is required");
        if (namespace.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("namespace and name must not be blank");
        }
    }

    /**
     * Parse a {@code Namespace/Name} path, splitting on the last slash
     * ({@code AWS/EC2/CPUUtilization} becomes {@code AWS/EC2} + {@code CPUUtilization}).
     */
    public static MetricName parse(String path, MetricUnit unit) {
        Objects.requireNonNull(path, "metric path is required");
        int slash = path.trim().lastIndexOf('/');
        if (slash <= 0 || slash == path.trim().length() - 1) {
            throw new IllegalArgumentException("Metric must look like Namespace/Name: " + path);
        }
        String trimmed = path.trim();
        return new MetricName(trimmed.substring(0, slash), trimmed.substring(slash + 1), unit);
    }

    /** Full path, e.g. AWS/EC2/CPUUtilization */
    public String path() {
        return namespace + "/" + name;
    }

    @Override
    public String toString() {
        return path();
    }
}
