package fleetwatch;

import fleetwatch.monitor.config.Dependencies;
import fleetwatch.monitor.config.IniLoader;
import fleetwatch.monitor.config.MonitorConfig;
import fleetwatch.monitor.error.ConfigException;
import fleetwatch.monitor.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar fleetwatch.jar [config.ini]
 * </pre>
 *
 * Without an INI file the configuration comes from FLEETWATCH_* environment variables.
 * Exits 0 once the fleet drains, 1 if the loop was stopped or failed, 2 on bad configuration.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        MonitorConfig config;
        try {
            config = (args.length > 0 ? IniLoader.load(Path.of(args[0])) : MonitorConfig.defaults())
                    .withEnv(System.getenv())
                    .validate();
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        System.exit(run(config));
    }

    static int run(MonitorConfig config) {
        try (Dependencies deps = Dependencies.create(config)) {
            deps.metricStore().recover(config.metrics());

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown requested, stopping fleet monitor...");
                deps.monitor().stop();
            }, "fleetwatch-shutdown"));

            deps.monitor().start();
            RunSummary summary = deps.monitor().awaitCompletion();
            deps.summaryWriter().write(summary, deps.sampleLog().location());
            return summary.drained() ? 0 : 1;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the fleet monitor");
            return 1;
        } catch (ExecutionException e) {
            log.error("Fleet monitor failed", e.getCause());
            return 1;
        }
    }
}
