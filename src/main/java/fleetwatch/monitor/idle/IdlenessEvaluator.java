package fleetwatch.monitor.idle;

import java.util.List;

/**
 * Decides whether an instance has gone idle from its most recent utilization values.
 *
 * An instance is idle when each of its last {@code lookback} values is below the
 * threshold. With fewer than {@code lookback} values it is never idle.
 */
public final class IdlenessEvaluator {

    private final int lookback;
    private final double threshold;

    public IdlenessEvaluator(int lookback, double threshold) {
        if (lookback < 1) {
            throw new IllegalArgumentException("lookback must be at least 1, got " + lookback);
        }
        this.lookback = lookback;
        this.threshold = threshold;
    }

    /**
     * @param recentValues values ordered oldest to newest
     * @return true iff at least {@code lookback} values exist and the max of the last
     *         {@code lookback} is strictly below the threshold
     */
    public boolean isIdle(List<Double> recentValues) {
        if (recentValues.size() < lookback) {
            return false;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (Double value : recentValues.subList(recentValues.size() - lookback, recentValues.size())) {
            max = Math.max(max, value);
        }
        return max < threshold;
    }

    public int lookback() {
        return lookback;
    }

    public double threshold() {
        return threshold;
    }
}
