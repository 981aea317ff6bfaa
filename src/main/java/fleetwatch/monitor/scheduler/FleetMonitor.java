package fleetwatch.monitor.scheduler;

import fleetwatch.monitor.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the FleetController loop on a dedicated daemon thread.
 *
 * The caller starts the monitor, goes on with its own work (launching the pipeline),
 * then joins with {@link #awaitCompletion()} once the fleet is expected to drain.
 * {@link #stop()} cancels the loop without waiting out the current sleep.
 */
public class FleetMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FleetMonitor.class);

    private final FleetController controller;
    private final CompletableFuture<RunSummary> completion = new CompletableFuture<>();

    private Thread thread;
    private volatile boolean running = false;

    public FleetMonitor(FleetController controller) {
        this.controller = controller;
    }

    /**
     * Start the loop thread.
     */
    public synchronized void start() {
        if (running || completion.isDone()) {
            log.warn("Fleet monitor already started");
            return;
        }
        running = true;
        thread = new Thread(this::runLoop, "fleetwatch-monitor");
        thread.setDaemon(true);
        thread.start();
        log.info("Fleet monitor thread started");
    }

    /**
     * Cancel the loop. Returns immediately; use {@link #awaitCompletion()} to join.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        thread.interrupt();
        log.info("Fleet monitor stop requested");
    }

    /**
     * Block until the loop ends.
     *
     * @return summary of the run; {@code drained} is false if the loop was stopped
     * @throws ExecutionException if the loop died, typically on a persistence failure
     */
    public RunSummary awaitCompletion() throws InterruptedException, ExecutionException {
        return completion.get();
    }

    /**
     * Block until the loop ends or the timeout elapses.
     */
    public RunSummary awaitCompletion(Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Check if the loop thread is running.
     */
    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runLoop() {
        try {
            RunSummary summary = controller.run();
            completion.complete(summary);
        } catch (InterruptedException e) {
            log.info("Fleet monitor stopped before the fleet drained");
            completion.complete(controller.summary(false));
        } catch (RuntimeException e) {
            log.error("Fleet monitor failed", e);
            completion.completeExceptionally(e);
        } finally {
            running = false;
            controller.close();
        }
    }
}
