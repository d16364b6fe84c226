package com.adlanda.documentsearch.exception;

/**
 * Thrown when a similarity query against the store fails.
 */
public class DatabaseSearchException extends DocumentSearchException {

    public DatabaseSearchException(String message) {
        super(message);
    }

    public DatabaseSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
