package com.adlanda.documentsearch.exception;

/**
 * Thrown when text cannot be extracted from a source document.
 */
public class DocumentProcessingException extends DocumentSearchException {

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
