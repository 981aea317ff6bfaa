package fleetwatch.monitor.config;

import fleetwatch.monitor.error.ConfigException;
import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.MetricUnit;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Configuration holder for the fleet monitor.
 * All settings have sensible defaults except the cluster tag.
 */
public final class MonitorConfig {

    public static final MetricName CPU_UTILIZATION = new MetricName("AWS/EC2", "CPUUtilization", MetricUnit.PERCENT);

    private static final List<MetricName> DEFAULT_METRICS = List.of(
            CPU_UTILIZATION,
            new MetricName("CGCloud", "MemUsage", MetricUnit.PERCENT),
            new MetricName("CGCloud", "DiskUsage_mnt_ephemeral", MetricUnit.PERCENT),
            new MetricName("CGCloud", "DiskUsage_root", MetricUnit.PERCENT),
            new MetricName("AWS/EC2", "NetworkIn", MetricUnit.BYTES),
            new MetricName("AWS/EC2", "NetworkOut", MetricUnit.BYTES),
            new MetricName("AWS/EC2", "DiskWriteOps", MetricUnit.COUNT),
            new MetricName("AWS/EC2", "DiskReadOps", MetricUnit.COUNT));

    // Fleet settings
    private String region = "us-west-2";
    private String clusterTag;
    private String clusterTagKey = "cluster_name";
    private String workerName;

    // Loop settings
    private Duration collectionInterval = Duration.ofHours(1);
    private Duration warmUp = Duration.ofMinutes(15);
    private Duration lookahead = Duration.ofMinutes(5);
    private Duration watermarkSafetyMargin = Duration.ofMinutes(30);
    private int collectionParallelism = 4;

    // Metric settings
    private List<MetricName> metrics = DEFAULT_METRICS;
    private MetricName idleMetric = CPU_UTILIZATION;
    private Duration period = Duration.ofMinutes(5);
    private String statistic = "Average";

    // Idle settings
    private int idleLookback = 3;
    private double idleThreshold = 0.5;

    // Retry settings
    private int retryMaxAttempts = 4;
    private Duration retryInitialDelay = Duration.ofSeconds(30);
    private Duration retryDelayIncrement = Duration.ofSeconds(10);

    // Watchdog settings
    private boolean watchdogEnabled = false;
    private double watchdogThreshold = 0.5;
    private int watchdogEvaluationPeriods = 6;

    // Output settings
    private Path outputDirectory = Path.of(".");
    private String runId = UUID.randomUUID().toString();

    private MonitorConfig() {
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig();
    }

    public static MonitorConfig fromEnv() {
        return defaults().withEnv(System.getenv());
    }

    /**
     * Apply FLEETWATCH_* overrides from the given environment.
     */
    public MonitorConfig withEnv(Map<String, String> env) {
        String cluster = env.get("FLEETWATCH_CLUSTER");
        if (cluster != null && !cluster.isBlank()) {
            this.clusterTag = cluster.trim();
        }

        String workerName = env.get("FLEETWATCH_WORKER_NAME");
        if (workerName != null && !workerName.isBlank()) {
            this.workerName = workerName.trim();
        }

        String region = env.get("FLEETWATCH_REGION");
        if (region != null && !region.isBlank()) {
            this.region = region.trim();
        }

        String outputDir = env.get("FLEETWATCH_OUTPUT_DIR");
        if (outputDir != null && !outputDir.isBlank()) {
            this.outputDirectory = Path.of(outputDir.trim());
        }

        String runId = env.get("FLEETWATCH_RUN_ID");
        if (runId != null && !runId.isBlank()) {
            this.runId = runId.trim();
        }

        String threshold = env.get("FLEETWATCH_IDLE_THRESHOLD");
        if (threshold != null && !threshold.isBlank()) {
            try {
                this.idleThreshold = Double.parseDouble(threshold.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("FLEETWATCH_IDLE_THRESHOLD is not a number: " + threshold, e);
            }
        }

        return this;
    }

    /**
     * Check cross-field constraints. Called before the loop is wired.
     *
     * @return this config
     * @throws ConfigException on the first violated constraint
     */
    public MonitorConfig validate() {
        if (clusterTag == null || clusterTag.isBlank()) {
            throw new ConfigException("Cluster tag is required");
        }
        if (metrics.isEmpty()) {
            throw new ConfigException("At least one metric must be tracked");
        }
        Set<String> fileNames = new HashSet<>();
        for (MetricName metric : metrics) {
            if (!fileNames.add(metric.name())) {
                throw new ConfigException("Two tracked metrics share the name " + metric.name());
            }
        }
        if (!metrics.contains(idleMetric)) {
            throw new ConfigException("Idle metric " + idleMetric + " is not among the tracked metrics");
        }
        if (idleMetric.unit() != MetricUnit.PERCENT) {
            throw new ConfigException("Idle metric " + idleMetric + " must be a PERCENT metric, got " + idleMetric.unit());
        }
        if (idleThreshold < 0.0 || idleThreshold > 100.0) {
            throw new ConfigException("Idle threshold must be within 0-100 percent, got " + idleThreshold);
        }
        if (idleLookback < 1) {
            throw new ConfigException("Idle lookback must be at least 1 sample");
        }
        if (period.compareTo(Duration.ofMinutes(1)) < 0) {
            throw new ConfigException("Metric period must be at least one minute");
        }
        if (period.multipliedBy(idleLookback).compareTo(Duration.ofMinutes(15)) < 0) {
            throw new ConfigException("Idle lookback of " + idleLookback + " x " + period
                    + " covers less than 15 minutes");
        }
        if (retryMaxAttempts < 1) {
            throw new ConfigException("Retry budget must allow at least one attempt");
        }
        if (collectionParallelism < 1) {
            throw new ConfigException("Collection parallelism must be at least 1");
        }
        if (collectionInterval.isNegative() || warmUp.isNegative() || lookahead.isNegative()
                || watermarkSafetyMargin.isNegative()) {
            throw new ConfigException("Durations must not be negative");
        }
        return this;
    }

    // Getters
    public String region() {
        return region;
    }

    public String clusterTag() {
        return clusterTag;
    }

    public String clusterTagKey() {
        return clusterTagKey;
    }

    /** Value of the Name tag workers carry, or null to match any name */
    public String workerName() {
        return workerName;
    }

    public Duration collectionInterval() {
        return collectionInterval;
    }

    public Duration warmUp() {
        return warmUp;
    }

    public Duration lookahead() {
        return lookahead;
    }

    public Duration watermarkSafetyMargin() {
        return watermarkSafetyMargin;
    }

    public int collectionParallelism() {
        return collectionParallelism;
    }

    public List<MetricName> metrics() {
        return metrics;
    }

    public MetricName idleMetric() {
        return idleMetric;
    }

    public Duration period() {
        return period;
    }

    public String statistic() {
        return statistic;
    }

    public int idleLookback() {
        return idleLookback;
    }

    public double idleThreshold() {
        return idleThreshold;
    }

    public int retryMaxAttempts() {
        return retryMaxAttempts;
    }

    public Duration retryInitialDelay() {
        return retryInitialDelay;
    }

    public Duration retryDelayIncrement() {
        return retryDelayIncrement;
    }

    public boolean watchdogEnabled() {
        return watchdogEnabled;
    }

    public double watchdogThreshold() {
        return watchdogThreshold;
    }

    public int watchdogEvaluationPeriods() {
        return watchdogEvaluationPeriods;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public String runId() {
        return runId;
    }

    // Fluent setters for testing/customization
    public MonitorConfig withRegion(String region) {
        this.region = region;
        return this;
    }

    public MonitorConfig withClusterTag(String clusterTag) {
        this.clusterTag = clusterTag;
        return this;
    }

    public MonitorConfig withClusterTagKey(String clusterTagKey) {
        this.clusterTagKey = clusterTagKey;
        return this;
    }

    public MonitorConfig withWorkerName(String workerName) {
        this.workerName = workerName;
        return this;
    }

    public MonitorConfig withCollectionInterval(Duration interval) {
        this.collectionInterval = interval;
        return this;
    }

    public MonitorConfig withWarmUp(Duration warmUp) {
        this.warmUp = warmUp;
        return this;
    }

    public MonitorConfig withLookahead(Duration lookahead) {
        this.lookahead = lookahead;
        return this;
    }

    public MonitorConfig withWatermarkSafetyMargin(Duration margin) {
        this.watermarkSafetyMargin = margin;
        return this;
    }

    public MonitorConfig withCollectionParallelism(int parallelism) {
        this.collectionParallelism = parallelism;
        return this;
    }

    public MonitorConfig withMetrics(List<MetricName> metrics) {
        this.metrics = List.copyOf(metrics);
        return this;
    }

    public MonitorConfig withIdleMetric(MetricName idleMetric) {
        this.idleMetric = idleMetric;
        return this;
    }

    public MonitorConfig withPeriod(Duration period) {
        this.period = period;
        return this;
    }

    public MonitorConfig withStatistic(String statistic) {
        this.statistic = statistic;
        return this;
    }

    public MonitorConfig withIdleLookback(int lookback) {
        this.idleLookback = lookback;
        return this;
    }

    public MonitorConfig withIdleThreshold(double threshold) {
        this.idleThreshold = threshold;
        return this;
    }

    public MonitorConfig withRetry(int maxAttempts, Duration initialDelay, Duration increment) {
        this.retryMaxAttempts = maxAttempts;
        this.retryInitialDelay = initialDelay;
        this.retryDelayIncrement = increment;
        return this;
    }

    public MonitorConfig withWatchdog(boolean enabled, double threshold, int evaluationPeriods) {
        this.watchdogEnabled = enabled;
        this.watchdogThreshold = threshold;
        this.watchdogEvaluationPeriods = evaluationPeriods;
        return this;
    }

    public MonitorConfig withOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    public MonitorConfig withRunId(String runId) {
        this.runId = runId;
        return this;
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "region='" + region + '\'' +
                ", cluster='" + clusterTag + '\'' +
                ", workerName='" + workerName + '\'' +
                ", interval=" + collectionInterval +
                ", warmUp=" + warmUp +
                ", metrics=" + metrics.size() +
                ", idle=" + idleMetric + " < " + idleThreshold + " over " + idleLookback +
                ", retries=" + retryMaxAttempts +
                ", watchdog=" + watchdogEnabled +
                ", runId='" + runId + '\'' +
                '}';
    }
}
