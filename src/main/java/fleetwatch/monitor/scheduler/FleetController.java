package fleetwatch.monitor.scheduler;

import fleetwatch.monitor.config.MonitorConfig;
import fleetwatch.monitor.core.Sleeper;
import fleetwatch.monitor.error.PersistenceException;
import fleetwatch.monitor.error.TerminationFailedException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.FleetGateway;
import fleetwatch.monitor.gateway.TerminationGate;
import fleetwatch.monitor.idle.IdlenessEvaluator;
import fleetwatch.monitor.metrics.MetricsClient;
import fleetwatch.monitor.model.AlarmAction;
import fleetwatch.monitor.model.CycleReport;
import fleetwatch.monitor.model.FetchResult;
import fleetwatch.monitor.model.FetchStatus;
import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.RunSummary;
import fleetwatch.monitor.model.Sample;
import fleetwatch.monitor.store.MetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The idle-detection and cost-control loop.
 *
 * Each cycle:
 * 1. Enumerate live workers (empty means the fleet has drained and the loop ends)
 * 2. Collect every tracked metric per instance from its watermark, persist, advance
 * 3. Evaluate the idle metric's recent window
 * 4. Terminate idle instances
 * 5. Sleep for what is left of the collection interval
 *
 * Failures are isolated per (instance, metric). Only {@link PersistenceException} and
 * interruption leave {@link #run()}.
 */
public class FleetController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FleetController.class);

    private final MonitorConfig config;
    private final FleetGateway fleet;
    private final MetricsClient metricsClient;
    private final MetricStore store;
    private final IdlenessEvaluator evaluator;
    private final TerminationGate gate;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService collectors;

    // Loop state, touched only by the loop thread
    private final Set<String> tracked = new LinkedHashSet<>();
    private final Set<String> retired = new LinkedHashSet<>();
    private final Set<String> armed = new LinkedHashSet<>();
    private final Set<String> seen = new TreeSet<>();
    private final Set<String> terminated = new TreeSet<>();
    private final Set<String> vanished = new TreeSet<>();
    private final Map<String, AtomicLong> samplesPersisted = new LinkedHashMap<>();
    private int cycles;
    private Instant startedAt;

    /**
     * @param gate optional watchdog, may be null
     */
    public FleetController(MonitorConfig config, FleetGateway fleet, MetricsClient metricsClient,
            MetricStore store, IdlenessEvaluator evaluator, TerminationGate gate,
            Sleeper sleeper, Clock clock) {
        this.config = config;
        this.fleet = fleet;
        this.metricsClient = metricsClient;
        this.store = store;
        this.evaluator = evaluator;
        this.gate = gate;
        this.sleeper = sleeper;
        this.clock = clock;

        AtomicInteger threadNo = new AtomicInteger();
        this.collectors = Executors.newFixedThreadPool(config.collectionParallelism(), r -> {
            Thread t = new Thread(r, "fleetwatch-collector-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        for (MetricName metric : config.metrics()) {
            samplesPersisted.put(metric.name(), new AtomicLong());
        }
    }

    /**
     * Run until the fleet drains.
     *
     * @return summary of the run, with {@code drained = true}
     * @throws InterruptedException if stopped from outside
     * @throws PersistenceException if samples could not be persisted
     */
    public RunSummary run() throws InterruptedException {
        startedAt = clock.instant();
        log.info("Fleet monitor started for cluster '{}' ({} metrics, idle: {} < {} over {} samples)",
                config.clusterTag(), config.metrics().size(), config.idleMetric(),
                config.idleThreshold(), evaluator.lookback());

        if (!config.warmUp().isZero()) {
            log.info("Waiting {} min before initial collection", config.warmUp().toMinutes());
            sleeper.sleep(config.warmUp());
        }

        while (true) {
            Instant cycleStart = clock.instant();
            CycleReport report = runCycle();
            if (report.drained()) {
                log.info("Fleet drained after {} collection cycles", cycles);
                return summary(true);
            }
            pace(cycleStart);
        }
    }

    /**
     * Run a single enumerate/collect/evaluate/act cycle (no pacing).
     * An enumeration that finds no live worker does not count as a collection cycle.
     */
    public CycleReport runCycle() throws InterruptedException {
        if (startedAt == null) {
            startedAt = clock.instant();
        }
        int cycle = cycles + 1;
        Instant cycleStart = clock.instant();

        // 1. Enumerate
        Set<String> live;
        try {
            live = enumerate();
        } catch (TransientBackendException e) {
            if (tracked.isEmpty()) {
                log.warn("Cycle {}: could not list workers and none are tracked yet, skipping: {}",
                        cycle, e.getMessage());
                cycles = cycle;
                return CycleReport.skipped(cycle, "fleet membership unavailable: " + e.getMessage(),
                        Duration.between(cycleStart, clock.instant()));
            }
            log.warn("Cycle {}: could not list workers, reusing {} tracked instances: {}",
                    cycle, tracked.size(), e.getMessage());
            live = new LinkedHashSet<>(tracked);
        }
        if (live.isEmpty()) {
            tracked.clear();
            return CycleReport.drained(cycle, Duration.between(cycleStart, clock.instant()));
        }
        cycles = cycle;
        seen.addAll(live);
        armWatchdogs(live);

        // 2. Collect
        List<InstanceCollection> collections = collect(live);

        List<String> dropped = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int fetches = 0;
        int transientFailures = 0;
        for (InstanceCollection c : collections) {
            if (c.gone) {
                dropped.add(c.instanceId);
            }
            skipped.addAll(c.skipped);
            fetches += c.fetches;
            transientFailures += c.transientFailures;
            c.newSamples.forEach((metric, added) ->
                    samplesPersisted.computeIfAbsent(metric, m -> new AtomicLong()).addAndGet(added));
        }

        // 3. Evaluate
        List<String> flagged = new ArrayList<>();
        if (fetches > 0 && transientFailures == fetches) {
            log.warn("Cycle {}: telemetry backend failed every fetch ({}), skipping evaluation", cycle, fetches);
        } else {
            for (InstanceCollection c : collections) {
                if (c.gone || !c.idleMetricCollected) continue;
                List<Double> window = store.recentValues(config.idleMetric(), c.instanceId, evaluator.lookback());
                if (evaluator.isIdle(window)) {
                    log.info("Instance {} idle: last {} {} values {}", c.instanceId, window.size(),
                            config.idleMetric().name(), window);
                    flagged.add(c.instanceId);
                }
            }
        }

        // 4. Act
        List<String> killed = new ArrayList<>();
        List<String> failedKills = new ArrayList<>();
        for (String instanceId : flagged) {
            try {
                fleet.terminateInstances(List.of(instanceId));
                killed.add(instanceId);
                log.info("Terminated idle instance {}", instanceId);
            } catch (TerminationFailedException e) {
                failedKills.add(instanceId);
                log.warn("Error terminating instance {}, will retry next cycle: {}", instanceId, e.getMessage());
            } catch (RuntimeException e) {
                failedKills.add(instanceId);
                log.error("Unexpected error terminating instance {}", instanceId, e);
            }
        }

        // New tracked set: this cycle's live set minus drops and terminations
        Set<String> stillTracked = new LinkedHashSet<>(live);
        dropped.forEach(stillTracked::remove);
        killed.forEach(stillTracked::remove);
        // Retired instances are never polled again
        dropped.forEach(store::forget);
        killed.forEach(store::forget);
        tracked.clear();
        tracked.addAll(stillTracked);

        retired.addAll(dropped);
        retired.addAll(killed);
        vanished.addAll(dropped);
        terminated.addAll(killed);

        CycleReport report = new CycleReport(cycle, false, new ArrayList<>(live), flagged, killed, failedKills,
                dropped, skipped, Duration.between(cycleStart, clock.instant()));

        log.info("Cycle {}: polled={} idle={} terminated={} terminationFailures={} dropped={} skipped={} tracked={} elapsed={}ms",
                cycle, report.polled().size(), report.flaggedIdle().size(), report.terminated().size(),
                report.terminationFailures().size(), report.dropped().size(), report.skipped().size(),
                tracked.size(), report.elapsed().toMillis());
        for (String reason : skipped) {
            log.warn("Cycle {}: skipped {}", cycle, reason);
        }
        return report;
    }

    /**
     * Build the summary of the run so far.
     *
     * @param drained whether the loop ended because the fleet drained
     */
    public RunSummary summary(boolean drained) {
        Map<String, Long> persisted = new TreeMap<>();
        samplesPersisted.forEach((metric, count) -> persisted.put(metric, count.get()));
        return new RunSummary(
                config.runId(),
                store.sampleLog().location().toString(),
                startedAt,
                clock.instant(),
                cycles,
                drained,
                List.copyOf(seen),
                List.copyOf(terminated),
                List.copyOf(vanished),
                persisted);
    }

    /** Instances still tracked after the last cycle */
    public Set<String> tracked() {
        return Set.copyOf(tracked);
    }

    @Override
    public void close() {
        collectors.shutdownNow();
        try {
            if (!collectors.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Collector pool did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Set<String> enumerate() throws TransientBackendException {
        Set<String> live = new LinkedHashSet<>(fleet.listWorkers(config.clusterTag()));
        live.removeAll(retired);
        return live;
    }

    private void armWatchdogs(Set<String> live) {
        if (gate == null || !config.watchdogEnabled()) {
            return;
        }
        for (String instanceId : live) {
            if (armed.contains(instanceId)) continue;
            try {
                gate.putAlarm(instanceId, config.idleMetric(), config.watchdogThreshold(), AlarmAction.TERMINATE);
                armed.add(instanceId);
                log.info("Watchdog alarm armed on {}", instanceId);
            } catch (TransientBackendException | RuntimeException e) {
                log.warn("Could not arm watchdog on {}, will retry next cycle: {}", instanceId, e.getMessage());
            }
        }
    }

    private List<InstanceCollection> collect(Set<String> live) throws InterruptedException {
        Instant windowEnd = clock.instant().plus(config.lookahead());

        List<Future<InstanceCollection>> futures = new ArrayList<>(live.size());
        for (String instanceId : live) {
            futures.add(collectors.submit(() -> collectInstance(instanceId, windowEnd)));
        }

        List<InstanceCollection> results = new ArrayList<>(live.size());
        try {
            int i = 0;
            for (String instanceId : live) {
                Future<InstanceCollection> future = futures.get(i++);
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof PersistenceException pe) {
                        throw pe;
                    }
                    if (cause instanceof InterruptedException) {
                        throw new InterruptedException("Collection of " + instanceId + " interrupted");
                    }
                    log.error("Collection failed for {}", instanceId, cause);
                    InstanceCollection failed = new InstanceCollection(instanceId);
                    failed.skipped.add(instanceId + ": collection failed: " + cause);
                    results.add(failed);
                }
            }
        } catch (InterruptedException | RuntimeException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
        return results;
    }

    private InstanceCollection collectInstance(String instanceId, Instant windowEnd) throws InterruptedException {
        InstanceCollection result = new InstanceCollection(instanceId);

        for (MetricName metric : config.metrics()) {
            // Each metric resumes from its own watermark
            Instant windowStart = store.watermark(metric, instanceId);
            FetchResult fetched = metricsClient.fetch(metric, instanceId, windowStart, windowEnd);
            result.fetches++;

            if (fetched.status() == FetchStatus.NOT_FOUND) {
                log.info("Instance {} no longer exists, dropping it from tracking", instanceId);
                result.gone = true;
                return result;
            }
            if (!fetched.isOk()) {
                if (fetched.status() == FetchStatus.RETRIES_EXHAUSTED) {
                    result.transientFailures++;
                }
                result.skipped.add(instanceId + " " + metric + ": " + fetched.reason());
                continue;
            }

            int added = store.append(metric, instanceId, fetched.samples());
            result.newSamples.merge(metric.name(), (long) added, Long::sum);
            Instant newest = null;
            for (Sample sample : fetched.samples()) {
                if (newest == null || sample.timestamp().isAfter(newest)) {
                    newest = sample.timestamp();
                }
            }
            // An empty window leaves the watermark where it is
            if (newest != null) {
                store.advanceWatermark(metric, instanceId, newest);
                store.trim(metric, instanceId, evaluator.lookback());
            }
            if (metric.equals(config.idleMetric())) {
                result.idleMetricCollected = true;
            }
        }
        return result;
    }

    private void pace(Instant cycleStart) throws InterruptedException {
        Duration elapsed = Duration.between(cycleStart, clock.instant());
        Duration remaining = config.collectionInterval().minus(elapsed);
        if (remaining.isNegative()) {
            log.warn("Collection took {}s, longer than the {}s interval; starting next cycle immediately",
                    elapsed.toSeconds(), config.collectionInterval().toSeconds());
            return;
        }
        if (remaining.isZero()) {
            return;
        }
        log.info("Sleeping {}s until next collection", remaining.toSeconds());
        sleeper.sleep(remaining);
    }

    /** Per-instance outcome of the collect step */
    private static final class InstanceCollection {
        private final String instanceId;
        private final List<String> skipped = new ArrayList<>();
        private final Map<String, Long> newSamples = new LinkedHashMap<>();
        private boolean gone;
        private boolean idleMetricCollected;
        private int fetches;
        private int transientFailures;

        private InstanceCollection(String instanceId) {
            this.instanceId = instanceId;
        }
    }
}
