package com.adlanda.documentsearch.controller;

import com.adlanda.documentsearch.store.VectorStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for inspecting and deleting indexed sources.
 */
@RestController
@RequestMapping("/api/v1/sources")
public class SourceController {

    private final VectorStore vectorStore;

    public SourceController(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    /**
     * List indexed sources with index statistics.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getSources() {
        List<String> sources = vectorStore.listSources();
        long totalChunks = vectorStore.count();
        return ResponseEntity.ok(Map.of(
                "sources", sources,
                "totalChunks", totalChunks,
                "status", totalChunks > 0 ? "indexed" : "empty"
        ));
    }

    /**
     * Delete every chunk of one source. Deleting an unknown source succeeds.
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteSource(@RequestParam String sourceId) {
        return deleteResponse(vectorStore.deleteBySource(sourceId), sourceId);
    }

    /**
     * Delete every chunk of every source.
     */
    @DeleteMapping("/all")
    public ResponseEntity<Map<String, Object>> deleteAll() {
        return deleteResponse(vectorStore.deleteAll(), "all");
    }

    private ResponseEntity<Map<String, Object>> deleteResponse(boolean deleted, String target) {
        Map<String, Object> body = Map.of("deleted", deleted, "target", target);
        return deleted
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
