package com.adlanda.documentsearch.controller;

import com.adlanda.documentsearch.exception.ConfigurationException;
import com.adlanda.documentsearch.exception.DatabaseException;
import com.adlanda.documentsearch.exception.DatabaseSearchException;
import com.adlanda.documentsearch.exception.DocumentProcessingException;
import com.adlanda.documentsearch.exception.EmbeddingGenerationException;
import com.adlanda.documentsearch.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps document search failures to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<Map<String, String>> handleDocumentProcessing(DocumentProcessingException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(EmbeddingGenerationException.class)
    public ResponseEntity<Map<String, String>> handleEmbedding(EmbeddingGenerationException e) {
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler({DatabaseException.class, DatabaseSearchException.class})
    public ResponseEntity<Map<String, String>> handleDatabase(RuntimeException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        log.error("Request failed ({}): {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "error", status.getReasonPhrase(),
                "message", String.valueOf(e.getMessage())
        ));
    }
}
