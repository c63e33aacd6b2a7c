package com.superteacher.utils;

/**
 * Fatal configuration problem found at startup, such as a missing API key
 * for a collaborator that was explicitly requested.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
