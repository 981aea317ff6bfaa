package fleetwatch.monitor.config;

import fleetwatch.monitor.error.ConfigException;
import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.MetricUnit;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads monitor settings from an INI file.
 * Sections: [FLEET] (required), [LOOP], [IDLE], [RETRY], [WATCHDOG], [OUTPUT], [METRICS].
 *
 * <pre>
 * [FLEET]
 * cluster_tag = gtex-transfer
 * worker_name = jtvivian_toil-worker
 *
 * [METRICS]
 * AWS/EC2/CPUUtilization = percent
 * AWS/EC2/NetworkIn = bytes
 * </pre>
 *
 * Keys that are absent keep the {@link MonitorConfig#defaults()} value.
 */
public final class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    private IniLoader() {
    }

    public static MonitorConfig load(Path file) {
        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file " + file, e);
        }

        Profile.Section fleet = ini.get("FLEET");
        if (fleet == null) {
            throw new ConfigException("Missing [FLEET] section in " + file);
        }

        MonitorConfig cfg = MonitorConfig.defaults();

        // FLEET
        cfg.withClusterTag(required(fleet, "cluster_tag"));
        String tagKey = opt(fleet, "cluster_tag_key");
        if (tagKey != null) cfg.withClusterTagKey(tagKey);
        String workerName = opt(fleet, "worker_name");
        if (workerName != null) cfg.withWorkerName(workerName);
        String region = opt(fleet, "region");
        if (region != null) cfg.withRegion(region);

        // METRICS (order of the section is kept)
        Profile.Section metricsSection = ini.get("METRICS");
        if (metricsSection != null && !metricsSection.isEmpty()) {
            List<MetricName> metrics = new ArrayList<>();
            for (String path : metricsSection.keySet()) {
                metrics.add(parseMetric(path, metricsSection.get(path)));
            }
            cfg.withMetrics(metrics);
        }

        // LOOP
        Profile.Section loop = ini.get("LOOP");
        Duration interval = minutes(loop, "interval_minutes");
        if (interval != null) cfg.withCollectionInterval(interval);
        Duration warmUp = minutes(loop, "warm_up_minutes");
        if (warmUp != null) cfg.withWarmUp(warmUp);
        Duration lookahead = minutes(loop, "lookahead_minutes");
        if (lookahead != null) cfg.withLookahead(lookahead);
        Duration margin = minutes(loop, "safety_margin_minutes");
        if (margin != null) cfg.withWatermarkSafetyMargin(margin);
        Integer parallelism = integer(loop, "parallelism");
        if (parallelism != null) cfg.withCollectionParallelism(parallelism);

        // IDLE
        Profile.Section idle = ini.get("IDLE");
        String idleMetric = opt(idle, "metric");
        if (idleMetric != null) {
            cfg.withIdleMetric(cfg.metrics().stream()
                    .filter(m -> m.path().equals(idleMetric))
                    .findFirst()
                    .orElseThrow(() -> new ConfigException("Idle metric " + idleMetric + " is not listed in [METRICS]")));
        }
        Integer lookback = integer(idle, "lookback");
        if (lookback != null) cfg.withIdleLookback(lookback);
        Double threshold = decimal(idle, "threshold");
        if (threshold != null) cfg.withIdleThreshold(threshold);
        Integer periodSeconds = integer(idle, "period_seconds");
        if (periodSeconds != null) cfg.withPeriod(Duration.ofSeconds(periodSeconds));
        String statistic = opt(idle, "statistic");
        if (statistic != null) cfg.withStatistic(statistic);

        // RETRY
        Profile.Section retry = ini.get("RETRY");
        if (retry != null) {
            cfg.withRetry(
                    orDefault(integer(retry, "max_attempts"), cfg.retryMaxAttempts()),
                    orDefault(seconds(retry, "initial_delay_seconds"), cfg.retryInitialDelay()),
                    orDefault(seconds(retry, "increment_seconds"), cfg.retryDelayIncrement()));
        }

        // WATCHDOG (optional)
        Profile.Section watchdog = ini.get("WATCHDOG");
        if (watchdog != null) {
            cfg.withWatchdog(
                    Boolean.parseBoolean(opt(watchdog, "enabled", "false")),
                    orDefault(decimal(watchdog, "threshold"), cfg.watchdogThreshold()),
                    orDefault(integer(watchdog, "evaluation_periods"), cfg.watchdogEvaluationPeriods()));
        }

        // OUTPUT
        Profile.Section output = ini.get("OUTPUT");
        String dir = opt(output, "dir");
        if (dir != null) cfg.withOutputDirectory(Path.of(dir));
        String runId = opt(output, "run_id");
        if (runId != null) cfg.withRunId(runId);

        log.info("Loaded config from {}: {}", file, cfg);
        return cfg;
    }

    private static MetricName parseMetric(String path, String unit) {
        try {
            return MetricName.parse(path, MetricUnit.parse(unit));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid metric entry '" + path + " = " + unit + "': " + e.getMessage(), e);
        }
    }

    // ===== helpers =====
    private static String required(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) {
            throw new ConfigException("Missing required key '" + key + "' in [" + s.getName() + "]");
        }
        return v;
    }

    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static Integer integer(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) return null;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ConfigException("Key '" + key + "' must be an integer, got '" + v + "'", e);
        }
    }

    private static Double decimal(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) return null;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new ConfigException("Key '" + key + "' must be a number, got '" + v + "'", e);
        }
    }

    private static Duration minutes(Profile.Section s, String key) {
        Integer v = integer(s, key);
        return v == null ? null : Duration.ofMinutes(v);
    }

    private static Duration seconds(Profile.Section s, String key) {
        Integer v = integer(s, key);
        return v == null ? null : Duration.ofSeconds(v);
    }

    private static <T> T orDefault(T value, T def) {
        return value == null ? def : value;
    }
}
