package com.adlanda.documentsearch.service;

import com.adlanda.documentsearch.chunking.ParagraphChunker;
import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.embedding.EmbeddingClient;
import com.adlanda.documentsearch.exception.DocumentSearchException;
import com.adlanda.documentsearch.model.QueryResponse;
import com.adlanda.documentsearch.model.SearchResult;
import com.adlanda.documentsearch.search.SimilaritySearchEngine;
import com.adlanda.documentsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for retrieving relevant chunks for a question.
 *
 * Orchestrates the query flow:
 * 1. Split the question into paragraph chunks
 * 2. Embed each chunk
 * 3. Search with every query vector and merge the ranked lists
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final ParagraphChunker chunker;
    private final EmbeddingClient embeddingClient;
    private final SimilaritySearchEngine searchEngine;
    private final VectorStore vectorStore;
    private final SearchResultFormatter formatter;
    private final DocumentSearchProperties properties;

    public RetrievalService(ParagraphChunker chunker,
                            EmbeddingClient embeddingClient,
                            SimilaritySearchEngine searchEngine,
                            VectorStore vectorStore,
                            SearchResultFormatter formatter,
                            DocumentSearchProperties properties) {
        this.chunker = chunker;
        this.embeddingClient = embeddingClient;
        this.searchEngine = searchEngine;
        this.vectorStore = vectorStore;
        this.formatter = formatter;
        this.properties = properties;
    }

    /**
     * Queries the store for chunks relevant to the question.
     *
     * @param question   The question to search for
     * @param maxResults Maximum number of results; null uses the configured default
     * @return QueryResponse containing the matched chunks and metadata
     */
    public QueryResponse query(String question, Integer maxResults) {
        long startTime = System.currentTimeMillis();
        int topK = maxResults != null ? maxResults : properties.getSearch().getTopK();

        List<SearchResult> results = search(question, topK);

        long queryTimeMs = System.currentTimeMillis() - startTime;
        log.debug("Query '{}' returned {} results in {}ms",
                truncate(question, 50), results.size(), queryTimeMs);

        return new QueryResponse(results, vectorStore.count(), queryTimeMs);
    }

    /**
     * Runs the query and renders the results for display. Failures are
     * reported in the returned text rather than thrown.
     */
    public String queryFormatted(String question, Integer maxResults) {
        log.info("Starting search pipeline for query: '{}'", truncate(question, 50));
        try {
            int topK = maxResults != null ? maxResults : properties.getSearch().getTopK();
            List<SearchResult> results = search(question, topK);
            if (results.isEmpty()) {
                log.warn("Search completed but no results found");
            } else {
                log.info("Search completed successfully: {} results found", results.size());
            }
            return formatter.format(results);
        } catch (DocumentSearchException e) {
            log.error("A known error occurred during search: {}", e.getMessage());
            return "Search failed: " + e.getMessage();
        } catch (RuntimeException e) {
            log.error("An unexpected error occurred during search", e);
            return "An unexpected error occurred. Please try again.";
        }
    }

    private List<SearchResult> search(String question, int topK) {
        List<float[]> queryVectors = embeddingClient.embed(chunker.chunk(question));
        return searchEngine.search(queryVectors, topK);
    }

    private String truncate(String s, int maxLen) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
