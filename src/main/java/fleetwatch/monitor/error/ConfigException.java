package fleetwatch.monitor.error;

/**
 * Invalid or incomplete monitor configuration.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
