package com.adlanda.documentsearch.controller;

import com.adlanda.documentsearch.model.QueryRequest;
import com.adlanda.documentsearch.model.QueryResponse;
import com.adlanda.documentsearch.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for searching the document index.
 */
@RestController
@RequestMapping("/api/v1/query")
public class QueryController {

    private final RetrievalService retrievalService;

    public QueryController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Search for chunks relevant to a question.
     *
     * @param request The query request containing the question
     * @return QueryResponse with matched chunks and metadata
     */
    @PostMapping
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        QueryResponse response = retrievalService.query(request.question(), request.maxResults());
        return ResponseEntity.ok(response);
    }

    /**
     * Same search, rendered as a ranked plain-text listing.
     */
    @PostMapping(value = "/formatted", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> queryFormatted(@Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(retrievalService.queryFormatted(request.question(), request.maxResults()));
    }
}
