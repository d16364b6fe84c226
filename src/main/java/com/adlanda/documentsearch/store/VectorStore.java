package com.adlanda.documentsearch.store;

import com.adlanda.documentsearch.exception.DatabaseException;
import com.adlanda.documentsearch.exception.DatabaseSearchException;
import com.adlanda.documentsearch.exception.ValidationException;
import com.adlanda.documentsearch.model.SearchResult;

import java.util.List;

/**
 * Storage for chunk texts, their embeddings and precomputed norms.
 *
 * Implementations own all persisted records. Every operation is
 * self-contained: it acquires whatever connection or lock it needs and
 * releases it before returning, on success and on failure.
 */
public interface VectorStore {

    /**
     * Creates the storage structures if they are missing. Safe to call repeatedly.
     *
     * @throws DatabaseException if the schema cannot be created
     */
    void ensureSchema();

    /**
     * Writes all chunks of one source atomically, each with its vector and norm.
     *
     * @param sourceId  Source identifier the chunks belong to
     * @param strategy  Chunking strategy tag
     * @param chunks    Chunk texts
     * @param vectors   Embedding vectors, index-aligned with {@code chunks}
     * @throws ValidationException if the lists are empty, differ in size, or the source id is blank
     * @throws DatabaseException if the write fails; nothing from the batch is kept
     */
    void insertAll(String sourceId, String strategy, List<String> chunks, List<float[]> vectors);

    /**
     * Removes every record of one source. Removing a source that is not stored succeeds.
     *
     * @return true on success, false if the delete failed
     */
    boolean deleteBySource(String sourceId);

    /**
     * Removes every record.
     *
     * @return true on success, false if the delete failed
     */
    boolean deleteAll();

    /**
     * Returns the distinct source identifiers, sorted ascending.
     *
     * @throws DatabaseException if the store cannot be read
     */
    List<String> listSources();

    /**
     * Returns the number of stored records.
     *
     * @throws DatabaseException if the store cannot be read
     */
    long count();

    /**
     * Scores every record with a positive norm against the query vector and
     * returns the best {@code topK}, highest cosine similarity first. Ties keep
     * storage order.
     *
     * @param queryVector  Query embedding
     * @param queryNorm    Euclidean norm of {@code queryVector}; must be positive
     * @param topK         Maximum number of results
     * @throws DatabaseSearchException if the query fails
     */
    List<SearchResult> findSimilar(float[] queryVector, double queryNorm, int topK);
}
