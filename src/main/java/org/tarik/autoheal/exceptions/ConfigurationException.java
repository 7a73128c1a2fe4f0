package org.tarik.autoheal.exceptions;

/**
 * Thrown when a task or its configuration can't start a run. Raised before any run exists and before any cost
 * is incurred.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
