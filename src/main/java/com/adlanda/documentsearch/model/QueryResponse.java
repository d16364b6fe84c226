package com.adlanda.documentsearch.model;

import java.util.List;

/**
 * Response from the query endpoint.
 *
 * @param results      Matched chunks in merged rank order
 * @param totalChunks  Total number of chunks in the store
 * @param queryTimeMs  Time taken to process the query in milliseconds
 */
public record QueryResponse(
        List<SearchResult> results,
        long totalChunks,
        long queryTimeMs
) {}
