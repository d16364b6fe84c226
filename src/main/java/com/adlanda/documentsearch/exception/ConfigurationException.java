package com.adlanda.documentsearch.exception;

/**
 * Thrown when required settings are missing or invalid.
 */
public class ConfigurationException extends DocumentSearchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
