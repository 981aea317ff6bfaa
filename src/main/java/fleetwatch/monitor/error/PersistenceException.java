package fleetwatch.monitor.error;

/**
 * Samples could not be written to or read from the run directory.
 * Fatal to the polling loop.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
