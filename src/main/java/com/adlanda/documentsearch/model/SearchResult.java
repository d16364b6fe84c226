package com.adlanda.documentsearch.model;

/**
 * A single result from a similarity search.
 *
 * @param chunkText  The text content of the matched chunk
 * @param sourceId   Path of the source document
 * @param strategy   Chunking strategy tag of the matched chunk
 * @param score      Cosine similarity (-1.0 to 1.0, higher is more similar)
 */
public record SearchResult(
        String chunkText,
        String sourceId,
        String strategy,
        double score
) {}
