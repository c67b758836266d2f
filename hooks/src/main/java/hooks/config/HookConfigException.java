package hooks.config;

/**
 * Exception thrown when hook configuration cannot be loaded or is invalid.
 *
 * <p>Thrown when a configuration file cannot be parsed or a value is out of range
 * (for example a non-positive poll interval).
 *
 * @see HookConfigLoader
 */
public class HookConfigException extends RuntimeException {

    public HookConfigException(String message) {
        super(message);
    }

    public HookConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
