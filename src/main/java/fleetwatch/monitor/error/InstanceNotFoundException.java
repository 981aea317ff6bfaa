package fleetwatch.monitor.error;

/**
 * The instance no longer exists, e.g. after spot reclamation.
 */
public class InstanceNotFoundException extends Exception {

    private final String instanceId;

    public InstanceNotFoundException(String instanceId, String message) {
        super(message);
        this.instanceId = instanceId;
    }

    public InstanceNotFoundException(String instanceId, String message, Throwable cause) {
        super(message, cause);
        this.instanceId = instanceId;
    }

    public String instanceId() {
        return instanceId;
    }
}
