package com.adlanda.documentsearch.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A persisted chunk together with its embedding vector.
 * Equality compares the embedding by content; {@code toString} shows its
 * dimension rather than every component.
 *
 * @param sourceId   Path of the originating document
 * @param chunkText  The chunk text
 * @param strategy   Chunking strategy tag
 * @param embedding  Embedding vector; dimensionality is fixed by the model
 * @param norm       Euclidean norm of {@code embedding}, computed when the record is written
 */
public record EmbeddingRecord(
        String sourceId,
        String chunkText,
        String strategy,
        float[] embedding,
        double norm
) {
    /**
     * Records with a zero (or negative) norm cannot be scored by cosine similarity.
     */
    public boolean isScorable() {
        return norm > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingRecord other)) return false;
        return Double.compare(norm, other.norm) == 0
                && Objects.equals(sourceId, other.sourceId)
                && Objects.equals(chunkText, other.chunkText)
                && Objects.equals(strategy, other.strategy)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(sourceId, chunkText, strategy, norm) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "EmbeddingRecord[sourceId=" + sourceId
                + ", chunkText=" + chunkText
                + ", strategy=" + strategy
                + ", dimensions=" + (embedding != null ? embedding.length : 0)
                + ", norm=" + norm + "]";
    }
}
