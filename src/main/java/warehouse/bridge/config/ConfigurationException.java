package warehouse.bridge.config;

/**
 * Fatal startup error: malformed service configuration, policy entries or connection settings.
 * Never produced while serving invocations.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
