package fleetwatch.monitor.error;

/**
 * Retryable cloud API failure: throttling, 5xx, client-side timeouts.
 */
public class TransientBackendException extends Exception {

    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
