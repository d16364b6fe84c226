package com.adlanda.documentsearch.exception;

/**
 * Thrown when text to be chunked or embedded is empty.
 */
public class InvalidInputException extends ValidationException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
