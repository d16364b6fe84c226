package com.adlanda.documentsearch.search;

import com.adlanda.documentsearch.exception.DatabaseSearchException;
import com.adlanda.documentsearch.exception.ValidationException;
import com.adlanda.documentsearch.model.SearchResult;
import com.adlanda.documentsearch.store.VectorStore;
import com.adlanda.documentsearch.store.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Exact cosine-similarity search over every stored record.
 *
 * Each query vector runs its own ranked query against the store; the
 * per-vector lists are then merged round-robin with duplicate chunks
 * collapsed to their best score.
 */
@Service
public class SimilaritySearchEngine {

    private static final Logger log = LoggerFactory.getLogger(SimilaritySearchEngine.class);

    private final VectorStore vectorStore;

    public SimilaritySearchEngine(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    /**
     * Searches with one or more query vectors.
     *
     * @param queryVectors Query embeddings, one per query chunk
     * @param topK         Maximum number of results
     * @return Up to {@code topK} results in merged rank order
     * @throws ValidationException if no query vectors are given or topK is below 1
     * @throws DatabaseSearchException if the store cannot be queried
     */
    public List<SearchResult> search(List<float[]> queryVectors, int topK) {
        if (queryVectors == null || queryVectors.isEmpty()) {
            log.error("No embeddings provided for search");
            throw new ValidationException("Cannot search without embeddings");
        }
        if (topK < 1) {
            throw new ValidationException("topK must be at least 1, was " + topK);
        }

        log.info("Searching with {} embeddings, top_k={}", queryVectors.size(), topK);

        List<List<SearchResult>> perVector = new ArrayList<>(queryVectors.size());
        for (int i = 0; i < queryVectors.size(); i++) {
            List<SearchResult> results = searchSingle(queryVectors.get(i), topK);
            perVector.add(results);
            log.info("Search for embedding #{}: Found {} results", i + 1, results.size());
        }

        List<SearchResult> merged = RoundRobinMerger.merge(perVector, topK);
        if (merged.isEmpty()) {
            log.warn("No similar chunks found for any of the query embeddings.");
        }
        return merged;
    }

    private List<SearchResult> searchSingle(float[] queryVector, int topK) {
        double queryNorm = Vectors.norm(queryVector);
        if (queryNorm == 0.0) {
            log.warn("Query vector norm is zero, cannot compute similarity.");
            return List.of();
        }
        return vectorStore.findSimilar(queryVector, queryNorm, topK);
    }
}
