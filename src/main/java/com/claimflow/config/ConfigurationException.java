package com.claimflow.config;

/**
 * Raised when the claims configuration document is missing, unreadable or
 * incomplete. Always fatal: the application context refuses to start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
