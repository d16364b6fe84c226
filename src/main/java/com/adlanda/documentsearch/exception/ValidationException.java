package com.adlanda.documentsearch.exception;

/**
 * Thrown when a caller supplies empty or mismatched input. Always recoverable by the caller.
 */
public class ValidationException extends DocumentSearchException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
