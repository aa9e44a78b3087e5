package org.example.integrationservice.core.exception;

/**
 * Raised at startup when a required integration setting is missing or malformed.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
