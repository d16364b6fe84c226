package com.adlanda.documentsearch.exception;

/**
 * Thrown when a write or connection fails. Writes are rolled back before this surfaces.
 */
public class DatabaseException extends DocumentSearchException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
