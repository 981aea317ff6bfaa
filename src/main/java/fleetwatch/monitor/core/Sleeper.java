package fleetwatch.monitor.core;

import java.time.Duration;

/**
 * The loop's only suspension point. Interrupting the sleeping thread cancels the wait.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
