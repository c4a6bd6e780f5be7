package ai.jira.adapter.config;

/**
 * Raised when the configuration file or site selection cannot be used.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
