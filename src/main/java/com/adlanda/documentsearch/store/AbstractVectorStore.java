package com.adlanda.documentsearch.store;

import com.adlanda.documentsearch.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Input checks shared by the vector store implementations.
 */
public abstract class AbstractVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractVectorStore.class);

    /**
     * @throws ValidationException if the batch cannot be written as one generation of records
     */
    protected void validateBatch(String sourceId, List<String> chunks, List<float[]> vectors) {
        String problem = null;
        if (chunks == null || chunks.isEmpty()) {
            problem = "Chunks list cannot be empty for indexing.";
        } else if (vectors == null || vectors.isEmpty()) {
            problem = "Embeddings list cannot be empty for indexing.";
        } else if (chunks.size() != vectors.size()) {
            problem = "Chunks count (" + chunks.size() + ") doesn't match embeddings count (" + vectors.size() + ").";
        } else if (sourceId == null || sourceId.isBlank()) {
            problem = "Source identifier cannot be empty for indexing.";
        }

        if (problem != null) {
            log.error("Data validation failed for '{}': {}", sourceId, problem);
            throw new ValidationException(problem);
        }
    }
}
