package fleetwatch.monitor.config;

import fleetwatch.cloud.alarm.CloudWatchAlarmGate;
import fleetwatch.cloud.auth.AwsClients;
import fleetwatch.cloud.fleet.Ec2FleetGateway;
import fleetwatch.cloud.metrics.CloudWatchMetricsBackend;
import fleetwatch.monitor.core.Sleeper;
import fleetwatch.monitor.gateway.FleetGateway;
import fleetwatch.monitor.gateway.MetricsBackend;
import fleetwatch.monitor.gateway.TerminationGate;
import fleetwatch.monitor.idle.IdlenessEvaluator;
import fleetwatch.monitor.metrics.MetricsClient;
import fleetwatch.monitor.report.RunSummaryWriter;
import fleetwatch.monitor.scheduler.FleetController;
import fleetwatch.monitor.scheduler.FleetMonitor;
import fleetwatch.monitor.store.MetricStore;
import fleetwatch.monitor.store.TsvSampleLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Manual dependency injection container.
 * Creates and wires the monitor and its backends.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(MonitorConfig.fromEnv().validate());
 * deps.metricStore().recover(config.metrics());
 * deps.monitor().start();
 * RunSummary summary = deps.monitor().awaitCompletion();
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final MonitorConfig config;
    private final AwsClients awsClients;
    private final FleetGateway fleetGateway;
    private final MetricsBackend metricsBackend;
    private final TerminationGate terminationGate;
    private final Clock clock;

    private final TsvSampleLog sampleLog;
    private final MetricStore metricStore;
    private final MetricsClient metricsClient;
    private final IdlenessEvaluator evaluator;
    private final FleetController controller;
    private final FleetMonitor monitor;
    private final RunSummaryWriter summaryWriter;

    private Dependencies(MonitorConfig config, AwsClients awsClients, FleetGateway fleetGateway,
            MetricsBackend metricsBackend, TerminationGate terminationGate, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.awsClients = awsClients;
        this.fleetGateway = fleetGateway;
        this.metricsBackend = metricsBackend;
        this.terminationGate = terminationGate;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        this.sampleLog = TsvSampleLog.forRun(config.outputDirectory(), config.runId(),
                LocalDate.now(clock));
        this.metricStore = new MetricStore(sampleLog,
                clock.instant().minus(config.watermarkSafetyMargin()));

        // Loop
        this.metricsClient = new MetricsClient(metricsBackend, sleeper, config);
        this.evaluator = new IdlenessEvaluator(config.idleLookback(), config.idleThreshold());
        this.controller = new FleetController(config, fleetGateway, metricsClient, metricStore,
                evaluator, terminationGate, sleeper, clock);
        this.monitor = new FleetMonitor(controller);
        this.summaryWriter = new RunSummaryWriter();

        log.info("Dependencies initialized, run directory {}", sampleLog.location());
    }

    /**
     * Create dependencies talking to AWS in the configured region.
     */
    public static Dependencies create(MonitorConfig config) {
        AwsClients clients = new AwsClients(config.region());
        TerminationGate gate = config.watchdogEnabled()
                ? new CloudWatchAlarmGate(clients.cloudWatch(), config.region(), config.period(),
                        config.watchdogEvaluationPeriods())
                : null;
        return new Dependencies(config, clients,
                new Ec2FleetGateway(clients.ec2(), config.clusterTagKey(), config.workerName()),
                new CloudWatchMetricsBackend(clients.cloudWatch()),
                gate,
                Sleeper.SYSTEM,
                Clock.systemUTC());
    }

    /**
     * Create dependencies over the given backends (no AWS clients are built).
     *
     * @param terminationGate optional, may be null
     */
    public static Dependencies create(MonitorConfig config, FleetGateway fleetGateway,
            MetricsBackend metricsBackend, TerminationGate terminationGate, Sleeper sleeper, Clock clock) {
        return new Dependencies(config, null, fleetGateway, metricsBackend, terminationGate, sleeper, clock);
    }

    public MonitorConfig config() {
        return config;
    }

    public FleetGateway fleetGateway() {
        return fleetGateway;
    }

    public MetricsBackend metricsBackend() {
        return metricsBackend;
    }

    public TerminationGate terminationGate() {
        return terminationGate;
    }

    public Clock clock() {
        return clock;
    }

    public TsvSampleLog sampleLog() {
        return sampleLog;
    }

    public MetricStore metricStore() {
        return metricStore;
    }

    public MetricsClient metricsClient() {
        return metricsClient;
    }

    public IdlenessEvaluator evaluator() {
        return evaluator;
    }

    public FleetController controller() {
        return controller;
    }

    public FleetMonitor monitor() {
        return monitor;
    }

    public RunSummaryWriter summaryWriter() {
        return summaryWriter;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            monitor.close();
        } catch (RuntimeException e) {
            log.warn("Error stopping fleet monitor: {}", e.getMessage());
        }
        controller.close();

        if (awsClients != null) {
            try {
                awsClients.close();
            } catch (RuntimeException e) {
                log.warn("Error closing AWS clients: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
