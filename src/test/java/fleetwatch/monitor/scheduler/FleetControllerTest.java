package fleetwatch.monitor.scheduler;

import fleetwatch.monitor.config.MonitorConfig;
import fleetwatch.monitor.error.PersistenceException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.TerminationGate;
import fleetwatch.monitor.idle.IdlenessEvaluator;
import fleetwatch.monitor.metrics.MetricsClient;
import fleetwatch.monitor.model.AlarmAction;
import fleetwatch.monitor.model.CycleReport;
import fleetwatch.monitor.model.MetricName;
import fleetwatch.monitor.model.MetricUnit;
import fleetwatch.monitor.model.RunSummary;
import fleetwatch.monitor.model.Sample;
import fleetwatch.monitor.store.MetricStore;
import fleetwatch.monitor.support.FakeFleetGateway;
import fleetwatch.monitor.support.InMemorySampleLog;
import fleetwatch.monitor.support.ManualClock;
import fleetwatch.monitor.support.RecordingSleeper;
import fleetwatch.monitor.support.ScriptedMetricsBackend;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static fleetwatch.monitor.support.ScriptedMetricsBackend.notFound;
import static fleetwatch.monitor.support.ScriptedMetricsBackend.throttled;
import static fleetwatch.monitor.support.ScriptedMetricsBackend.values;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the enumerate/collect/evaluate/act cycle and the run loop around it.
 */
class FleetControllerTest {

    private static final MetricName CPU = MonitorConfig.CPU_UTILIZATION;
    private static final MetricName NET_IN = new MetricName("AWS/EC2", "NetworkIn", MetricUnit.BYTES);
    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Duration PERIOD = Duration.ofMinutes(5);
    private static final Instant DEFAULT_WATERMARK = T0.minus(Duration.ofMinutes(30));

    private ManualClock clock;
    private RecordingSleeper sleeper;
    private FakeFleetGateway gateway;
    private ScriptedMetricsBackend backend;
    private InMemorySampleLog sampleLog;
    private MetricStore store;
    private MonitorConfig config;
    private FleetController controller;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(T0);
        sleeper = new RecordingSleeper(clock);
        gateway = new FakeFleetGateway();
        backend = new ScriptedMetricsBackend();
        sampleLog = new InMemorySampleLog();
        store = new MetricStore(sampleLog, DEFAULT_WATERMARK);
        config = MonitorConfig.defaults()
                .withClusterTag("gtex-transfer")
                .withMetrics(List.of(CPU, NET_IN))
                .withWarmUp(Duration.ZERO)
                .withCollectionParallelism(2)
                .withRetry(2, Duration.ofSeconds(30), Duration.ofSeconds(10))
                .validate();
    }

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.close();
        }
    }

    private FleetController controller(TerminationGate gate) {
        controller = new FleetController(config, gateway, new MetricsClient(backend, sleeper, config), store,
                new IdlenessEvaluator(config.idleLookback(), config.idleThreshold()), gate, sleeper, clock);
        return controller;
    }

    private FleetController controller() {
        return controller(null);
    }

    // ===== one cycle =====

    @Test
    void idleInstanceIsTerminatedAndBusyOneKept() throws Exception {
        gateway.thenList("i-idle", "i-busy");
        backend.on("i-idle", "CPUUtilization", values(T0, PERIOD, 0.1, 0.2, 0.3));
        backend.on("i-busy", "CPUUtilization", values(T0, PERIOD, 40.0, 55.0, 60.0));

        CycleReport report = controller().runCycle();

        assertFalse(report.drained());
        assertEquals(1, report.cycle());
        assertEquals(Set.of("i-idle", "i-busy"), Set.copyOf(report.polled()));
        assertEquals(List.of("i-idle"), report.flaggedIdle());
        assertEquals(List.of("i-idle"), report.terminated());
        assertEquals(List.of("i-idle"), gateway.terminated());
        assertEquals(Set.of("i-busy"), controller.tracked());
        assertEquals(3, store.size(CPU, "i-busy"));
        assertEquals(List.of("gtex-transfer"), gateway.clusterTags());
    }

    @Test
    void instanceWithTooFewSamplesIsNotFlagged() throws Exception {
        gateway.thenList("i-new");
        backend.on("i-new", "CPUUtilization", values(T0, PERIOD, 0.0, 0.0));

        CycleReport report = controller().runCycle();

        assertTrue(report.flaggedIdle().isEmpty());
        assertEquals(0, gateway.terminateCalls());
    }

    @Test
    void watermarkAdvancesToNewestSampleAfterCompleteCollection() throws Exception {
        gateway.thenList("i-a").thenList("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 30.0, 40.0, 50.0));

        controller().runCycle();
        clock.advance(Duration.ofHours(1));
        controller.runCycle();

        List<ScriptedMetricsBackend.Call> calls = backend.callsFor("i-a", "CPUUtilization");
        assertEquals(DEFAULT_WATERMARK, calls.get(0).start());
        assertEquals(T0.plus(config.lookahead()), calls.get(0).end());
        assertEquals(T0, calls.get(1).start());
        // Re-fetching the boundary sample does not duplicate it
        assertEquals(3, sampleLog.readAll(CPU).size());
    }

    @Test
    @DisplayName("A metric whose datapoints arrive late is still collected in full")
    void lateMetricIsFetchedFromItsOwnWatermark() throws Exception {
        gateway.thenList("i-a").thenList("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 30.0, 40.0, 50.0));
        // NetworkIn has nothing yet in the first cycle; afterwards the backend honours the window start
        backend.on("i-a", "NetworkIn",
                (id, start, end) -> List.of(),
                (id, start, end) -> values(T0, PERIOD, 512.0, 1024.0, 2048.0).answer(id, start, end).stream()
                        .filter(sample -> !sample.timestamp().isBefore(start))
                        .toList());

        controller().runCycle();
        clock.advance(Duration.ofHours(1));
        controller.runCycle();

        List<ScriptedMetricsBackend.Call> netIn = backend.callsFor("i-a", "NetworkIn");
        assertEquals(DEFAULT_WATERMARK, netIn.get(1).start());
        assertEquals(T0, backend.callsFor("i-a", "CPUUtilization").get(1).start());
        assertEquals(3, store.size(NET_IN, "i-a"));
        assertEquals(3, sampleLog.readAll(NET_IN).size());
        assertEquals(T0, store.watermark("i-a"));
    }

    @Test
    void failedFetchIsIsolatedToItsInstanceAndMetric() throws Exception {
        gateway.thenList("i-flaky", "i-idle");
        backend.on("i-flaky", "CPUUtilization", throttled());
        backend.on("i-idle", "CPUUtilization", values(T0, PERIOD, 0.1, 0.1, 0.1));

        CycleReport report = controller().runCycle();

        assertEquals(List.of("i-idle"), report.terminated());
        assertEquals(1, report.skipped().size());
        assertTrue(report.skipped().get(0).contains("i-flaky"));
        assertTrue(controller.tracked().contains("i-flaky"));
        // Incomplete collection leaves the window to be re-fetched next cycle
        assertEquals(DEFAULT_WATERMARK, store.watermark("i-flaky"));
        assertEquals(List.of(Duration.ofSeconds(30)), sleeper.sleeps());
    }

    @Test
    @DisplayName("Telemetry outage: nothing is evaluated or terminated")
    void backendOutageSkipsEvaluation() throws Exception {
        store.append(CPU, "i-a", List.of(
                new Sample("i-a", 0.1, T0.minus(PERIOD.multipliedBy(2))),
                new Sample("i-a", 0.1, T0.minus(PERIOD)),
                new Sample("i-a", 0.1, T0)));
        gateway.thenList("i-a");
        backend.on("i-a", "CPUUtilization", throttled());
        backend.on("i-a", "NetworkIn", throttled());

        CycleReport report = controller().runCycle();

        assertTrue(report.flaggedIdle().isEmpty());
        assertEquals(0, gateway.terminateCalls());
        assertEquals(2, report.skipped().size());
        assertEquals(Set.of("i-a"), controller.tracked());
    }

    @Test
    void staleIdleDataIsNotActedOnWhenIdleMetricFetchFailed() throws Exception {
        store.append(CPU, "i-a", List.of(
                new Sample("i-a", 0.1, T0.minus(PERIOD.multipliedBy(2))),
                new Sample("i-a", 0.1, T0.minus(PERIOD)),
                new Sample("i-a", 0.1, T0)));
        gateway.thenList("i-a");
        backend.on("i-a", "CPUUtilization", throttled());
        backend.on("i-a", "NetworkIn", values(T0, PERIOD, 2048.0));

        CycleReport report = controller().runCycle();

        assertTrue(report.flaggedIdle().isEmpty());
        assertEquals(1, store.size(NET_IN, "i-a"));
    }

    @Test
    @DisplayName("Failed termination keeps the instance tracked and retries it")
    void terminationFailureIsIsolatedAndRetriedNextCycle() throws Exception {
        gateway.thenList("i-a", "i-b").thenList("i-a", "i-b");
        gateway.failTerminationOf("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 0.1, 0.2, 0.3));
        backend.on("i-b", "CPUUtilization", values(T0, PERIOD, 0.1, 0.2, 0.3));

        CycleReport first = controller().runCycle();

        assertEquals(List.of("i-b"), first.terminated());
        assertEquals(List.of("i-a"), first.terminationFailures());
        assertEquals(Set.of("i-a"), controller.tracked());

        gateway.allowTermination("i-a");
        clock.advance(Duration.ofHours(1));
        CycleReport second = controller.runCycle();

        // i-b is still listed by the provider while it shuts down, but it is not polled again
        assertEquals(List.of("i-a"), second.polled());
        assertEquals(List.of("i-a"), second.terminated());
        assertEquals(List.of("i-b", "i-a"), gateway.terminated());
    }

    @Test
    void vanishedInstanceIsDroppedAndNotPolledAgain() throws Exception {
        gateway.thenList("i-a", "i-gone").thenList("i-a", "i-gone");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 20.0, 20.0, 20.0));
        backend.on("i-gone", "CPUUtilization", notFound());

        CycleReport first = controller().runCycle();
        CycleReport second = controller.runCycle();

        assertEquals(List.of("i-gone"), first.dropped());
        assertEquals(List.of("i-a"), second.polled());
        assertTrue(backend.callsFor("i-gone", "NetworkIn").isEmpty());
        assertEquals(1, backend.callsFor("i-gone", "CPUUtilization").size());

        RunSummary summary = controller.summary(false);
        assertEquals(List.of("i-gone"), summary.instancesVanished());
        assertTrue(summary.instancesTerminated().isEmpty());
    }

    @Test
    void membershipFailureWithNothingTrackedSkipsTheCycle() throws Exception {
        gateway.thenFail("RequestLimitExceeded").thenList("i-a");

        CycleReport first = controller().runCycle();
        CycleReport second = controller.runCycle();

        assertFalse(first.drained(), "an unreadable fleet is not a drained fleet");
        assertTrue(first.polled().isEmpty());
        assertEquals(1, first.skipped().size());
        assertEquals(1, first.cycle());
        assertEquals(2, second.cycle());
        assertEquals(List.of("i-a"), second.polled());
    }

    @Test
    void membershipFailureReusesTrackedInstances() throws Exception {
        gateway.thenList("i-a", "i-b").thenFail("ServiceUnavailable");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 20.0, 20.0, 20.0));

        controller().runCycle();
        CycleReport second = controller.runCycle();

        assertFalse(second.drained());
        assertEquals(Set.of("i-a", "i-b"), Set.copyOf(second.polled()));
    }

    @Test
    void persistenceFailureEscapesTheCycle() {
        gateway.thenList("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 20.0));
        sampleLog.failWrites(true);

        assertThrows(PersistenceException.class, () -> controller().runCycle());
    }

    // ===== run loop =====

    @Test
    @DisplayName("Two workers: one goes idle and is terminated, loop ends when the fleet drains")
    void runsUntilTheFleetDrains() throws Exception {
        config.withWarmUp(Duration.ofMinutes(15));
        gateway.thenList("i-a", "i-b").thenList("i-a", "i-b").thenList("i-a", "i-b");
        // i-a is busy in the first hour, then goes idle
        backend.on("i-a", "CPUUtilization",
                values(T0, PERIOD, 30.0, 40.0, 50.0),
                values(T0.plus(Duration.ofHours(1)), PERIOD, 0.1, 0.2, 0.3));
        backend.on("i-b", "CPUUtilization", values(T0, PERIOD, 70.0, 80.0, 90.0));

        RunSummary summary = controller().run();

        assertTrue(summary.drained());
        assertEquals(3, summary.cycles());
        assertEquals(List.of("i-a", "i-b"), summary.instancesSeen());
        assertEquals(List.of("i-a"), summary.instancesTerminated());
        assertEquals(9L, summary.samplesPersisted().get("CPUUtilization"));
        assertEquals(0L, summary.samplesPersisted().get("NetworkIn"));
        assertEquals(T0, summary.startedAt());

        // Warm-up, then one full interval after each cycle
        assertEquals(List.of(Duration.ofMinutes(15), Duration.ofHours(1), Duration.ofHours(1), Duration.ofHours(1)),
                sleeper.sleeps());
        assertEquals(2, backend.callsFor("i-a", "CPUUtilization").size(), "terminated instance is not polled again");
        assertEquals(4, gateway.clusterTags().size());
    }

    @Test
    void terminatedInstanceIsReleasedFromMemoryButKeptOnDisk() throws Exception {
        gateway.thenList("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 0.1, 0.1, 0.1));

        RunSummary summary = controller().run();

        assertEquals(List.of("i-a"), summary.instancesTerminated());
        assertEquals(0, store.size(CPU, "i-a"));
        assertEquals(DEFAULT_WATERMARK, store.watermark("i-a"));
        assertEquals(3, sampleLog.readAll(CPU).size());
    }

    @Test
    void longLivedInstanceKeepsOnlyWhatEvaluationNeeds() throws Exception {
        gateway.thenList("i-a").thenList("i-a").thenList("i-a");
        backend.on("i-a", "CPUUtilization",
                values(T0, PERIOD, 30.0, 40.0, 50.0),
                values(T0.plus(Duration.ofHours(1)), PERIOD, 60.0, 70.0, 80.0),
                values(T0.plus(Duration.ofHours(2)), PERIOD, 45.0, 55.0, 65.0));

        controller().runCycle();
        clock.advance(Duration.ofHours(1));
        controller.runCycle();
        clock.advance(Duration.ofHours(1));
        controller.runCycle();

        assertEquals(config.idleLookback(), store.size(CPU, "i-a"));
        assertEquals(List.of(45.0, 55.0, 65.0), store.recentValues(CPU, "i-a", 10));
        assertEquals(9, sampleLog.readAll(CPU).size());
    }

    @Test
    void emptyFleetAtStartEndsWithoutCycles() throws Exception {
        RunSummary summary = controller().run();

        assertTrue(summary.drained());
        assertEquals(0, summary.cycles());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void sleepsOnlyForWhatIsLeftOfTheInterval() throws Exception {
        gateway.thenList("i-a");
        backend.on("i-a", "CPUUtilization", (id, start, end) -> {
            clock.advance(Duration.ofMinutes(10));
            return List.of(new Sample(id, 50.0, T0));
        });

        controller().run();

        assertEquals(List.of(Duration.ofMinutes(50)), sleeper.sleeps());
    }

    @Test
    void overrunStartsNextCycleImmediately() throws Exception {
        gateway.thenList("i-a");
        backend.on("i-a", "CPUUtilization", (id, start, end) -> {
            clock.advance(Duration.ofHours(2));
            return List.of(new Sample(id, 50.0, T0));
        });

        RunSummary summary = controller().run();

        assertEquals(1, summary.cycles());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void zeroIntervalNeverSleeps() throws Exception {
        config.withCollectionInterval(Duration.ZERO);
        gateway.thenList("i-a").thenList("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 50.0));

        RunSummary summary = controller().run();

        assertEquals(2, summary.cycles());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    // ===== watchdog =====

    @Test
    void watchdogIsArmedOncePerInstanceAndRetriedOnFailure() throws Exception {
        config.withWatchdog(true, 0.5, 6);
        RecordingGate gate = new RecordingGate(1);
        gateway.thenList("i-a").thenList("i-a").thenList("i-a");
        backend.on("i-a", "CPUUtilization", values(T0, PERIOD, 50.0));

        controller(gate);
        controller.runCycle();
        controller.runCycle();
        controller.runCycle();

        assertEquals(List.of("i-a", "i-a"), gate.calls);
        assertEquals(CPU, gate.lastMetric);
        assertEquals(AlarmAction.TERMINATE, gate.lastAction);
        assertEquals(0.5, gate.lastThreshold);
    }

    @Test
    void watchdogIsOffByDefault() throws Exception {
        RecordingGate gate = new RecordingGate(0);
        gateway.thenList("i-a");

        controller(gate).runCycle();

        assertTrue(gate.calls.isEmpty());
    }

    private static final class RecordingGate implements TerminationGate {
        private final List<String> calls = new ArrayList<>();
        private int failuresLeft;
        private MetricName lastMetric;
        private AlarmAction lastAction;
        private double lastThreshold;

        private RecordingGate(int failures) {
            this.failuresLeft = failures;
        }

        @Override
        public void putAlarm(String instanceId, MetricName metric, double threshold, AlarmAction action)
                throws TransientBackendException {
            calls.add(instanceId);
            lastMetric = metric;
            lastAction = action;
            lastThreshold = threshold;
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new TransientBackendException("Throttling");
            }
        }
    }
}
