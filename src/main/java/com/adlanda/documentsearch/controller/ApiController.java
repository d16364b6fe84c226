package com.adlanda.documentsearch.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Document Search",
                "version", appVersion,
                "endpoints", Map.of(
                        "query", "POST /api/v1/query - Search indexed documents",
                        "queryFormatted", "POST /api/v1/query/formatted - Search, results as plain text",
                        "index", "POST /api/v1/documents - Index (or re-index) one document",
                        "indexFolder", "POST /api/v1/documents/folder - Index every document in a folder",
                        "sources", "GET /api/v1/sources - List indexed sources",
                        "deleteSource", "DELETE /api/v1/sources?sourceId= - Delete one source",
                        "deleteAll", "DELETE /api/v1/sources/all - Delete every source",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
