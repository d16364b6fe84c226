package com.adlanda.documentsearch.controller;

import com.adlanda.documentsearch.exception.ValidationException;
import com.adlanda.documentsearch.model.DocumentRequest;
import com.adlanda.documentsearch.model.FolderIndexingSummary;
import com.adlanda.documentsearch.model.IndexingOutcome;
import com.adlanda.documentsearch.service.IndexingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * REST controller for indexing documents.
 */
@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    private final IndexingService indexingService;

    public DocumentController(IndexingService indexingService) {
        this.indexingService = indexingService;
    }

    /**
     * Index one document, replacing any previous version of it.
     * Responds 422 when the pipeline fails; the outcome carries the cause.
     */
    @PostMapping
    public ResponseEntity<IndexingOutcome> index(@Valid @RequestBody DocumentRequest request) {
        IndexingOutcome outcome = indexingService.indexDocument(toPath(request.path()));
        return outcome.success()
                ? ResponseEntity.ok(outcome)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(outcome);
    }

    /**
     * Index every supported document in a folder.
     */
    @PostMapping("/folder")
    public ResponseEntity<FolderIndexingSummary> indexFolder(@Valid @RequestBody DocumentRequest request) {
        return ResponseEntity.ok(indexingService.indexFolder(toPath(request.path())));
    }

    private static Path toPath(String path) {
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            throw new ValidationException("Invalid path: " + e.getMessage(), e);
        }
    }
}
