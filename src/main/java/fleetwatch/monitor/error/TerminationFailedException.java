package fleetwatch.monitor.error;

import java.util.List;

/**
 * A terminate request was rejected or could not be delivered.
 */
public class TerminationFailedException extends Exception {

    private final List<String> instanceIds;

    public TerminationFailedException(List<String> instanceIds, String message, Throwable cause) {
        super(message, cause);
        this.instanceIds = List.copyOf(instanceIds);
    }

    public List<String> instanceIds() {
        return instanceIds;
    }
}
