package com.adlanda.documentsearch.model;

/**
 * A contiguous unit of source text, the atomic retrieval item.
 *
 * @param sourceId  Path of the originating document
 * @param text      The trimmed chunk text
 * @param strategy  Chunking strategy that produced this chunk (e.g. "paragraph")
 */
public record Chunk(
        String sourceId,
        String text,
        String strategy
) {}
