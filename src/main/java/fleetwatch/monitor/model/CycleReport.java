package fleetwatch.monitor.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one polling cycle.
 *
 * @param cycle               1-based cycle number
 * @param drained             no live workers were found; the loop ends
 * @param polled              instances collected this cycle
 * @param flaggedIdle         instances the evaluator flagged idle
 * @param terminated          instances terminated successfully
 * @param terminationFailures instances whose termination failed (still tracked)
 * @param dropped             instances that vanished (not found)
 * @param skipped             skipped (instance, metric) fetches with reasons
 * @param elapsed             wall time spent on the cycle
 */
public record CycleReport(
        int cycle,
        boolean drained,
        List<String> polled,
        List<String> flaggedIdle,
        List<String> terminated,
        List<String> terminationFailures,
        List<String> dropped,
        List<String> skipped,
        Duration elapsed) {

    public CycleReport {
        polled = List.copyOf(polled);
        flaggedIdle = List.copyOf(flaggedIdle);
        terminated = List.copyOf(terminated);
        terminationFailures = List.copyOf(terminationFailures);
        dropped = List.copyOf(dropped);
        skipped = List.copyOf(skipped);
    }

    /** Report of an enumeration that found no live workers */
    public static CycleReport drained(int cycle, Duration elapsed) {
        return new CycleReport(cycle, true, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), elapsed);
    }

    /** Report of a cycle skipped because fleet membership could not be read */
    public static CycleReport skipped(int cycle, String reason, Duration elapsed) {
        return new CycleReport(cycle, false, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(reason), elapsed);
    }
}
