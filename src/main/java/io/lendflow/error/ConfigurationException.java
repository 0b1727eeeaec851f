package io.lendflow.error;

/**
 * Invalid pattern catalog, settings file or agent wiring. Reported to the caller
 * immediately and never retried.
 */
public class ConfigurationException extends SystemFailureException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
