package in.voltedge.config;

/**
 * Invalid or unreadable configuration. Raised at startup only.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
