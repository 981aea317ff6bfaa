package fleetwatch.monitor.metrics;

import fleetwatch.monitor.config.MonitorConfig;
import fleetwatch.monitor.core.Sleeper;
import fleetwatch.monitor.error.InstanceNotFoundException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.MetricsBackend;
import fleetwatch.monitor.model.FetchResult;
import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fetches metric windows from the telemetry backend with bounded retries.
 *
 * Transient failures are retried after 30s, 40s, 50s... (initial delay plus a fixed
 * increment per retry) until the attempt budget is spent. Exhaustion is reported as a
 * {@link fleetwatch.monitor.model.FetchStatus#RETRIES_EXHAUSTED} result, never thrown.
 */
public class MetricsClient {

    private static final Logger log = LoggerFactory.getLogger(MetricsClient.class);

    private final MetricsBackend backend;
    private final Sleeper sleeper;
    private final Duration period;
    private final String statistic;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration delayIncrement;

    public MetricsClient(MetricsBackend backend, Sleeper sleeper, MonitorConfig config) {
        this.backend = backend;
        this.sleeper = sleeper;
        this.period = config.period();
        this.statistic = config.statistic();
        this.maxAttempts = config.retryMaxAttempts();
        this.initialDelay = config.retryInitialDelay();
        this.delayIncrement = config.retryDelayIncrement();
    }

    /**
     * Fetch one metric window for one instance.
     *
     * @throws InterruptedException if the loop was stopped while waiting to retry
     */
    public FetchResult fetch(MetricName metric, String instanceId, Instant windowStart, Instant windowEnd)
            throws InterruptedException {
        Duration delay = initialDelay;

        for (int attempt = 1; ; attempt++) {
            try {
                List<Sample> samples = backend.fetchMetricStatistics(
                        metric.namespace(), metric.name(), instanceId, windowStart, windowEnd, period, statistic);
                if (attempt > 1) {
                    log.info("Fetched {} for {} on attempt {}", metric, instanceId, attempt);
                }
                return FetchResult.ok(samples);

            } catch (InstanceNotFoundException e) {
                log.info("Instance {} not found while fetching {}: {}", instanceId, metric, e.getMessage());
                return FetchResult.notFound(e.getMessage());

            } catch (TransientBackendException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Giving up on {} for {} after {} attempts: {}",
                            metric, instanceId, attempt, e.getMessage());
                    return FetchResult.retriesExhausted(
                            "retries exhausted after " + attempt + " attempts: " + e.getMessage());
                }
                log.info("Transient failure fetching {} for {} (attempt {} of {}), retrying in {}s: {}",
                        metric, instanceId, attempt, maxAttempts, delay.toSeconds(), e.getMessage());
                sleeper.sleep(delay);
                delay = delay.plus(delayIncrement);

            } catch (RuntimeException e) {
                log.error("Failed to fetch {} for {}", metric, instanceId, e);
                return FetchResult.failed("fetch failed: " + e.getMessage());
            }
        }
    }
}
