package com.adlanda.documentsearch.exception;

/**
 * Thrown when embeddings cannot be generated, after the retry budget is spent.
 */
public class EmbeddingGenerationException extends DocumentSearchException {

    public EmbeddingGenerationException(String message) {
        super(message);
    }

    public EmbeddingGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
