package com.adlanda.documentsearch.exception;

/**
 * Base exception for indexing and search failures.
 *
 * All document search exceptions extend this class so callers at a batch
 * boundary can catch them as one family.
 */
public class DocumentSearchException extends RuntimeException {

    public DocumentSearchException(String message) {
        super(message);
    }

    public DocumentSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
