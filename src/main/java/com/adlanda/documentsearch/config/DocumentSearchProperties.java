package com.adlanda.documentsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for indexing and search.
 *
 * Maps to properties prefixed with 'docsearch' in application.properties.
 * Every value can be overridden from the environment, e.g.
 * DOCSEARCH_EMBEDDING_API_KEY.
 */
@Component
@ConfigurationProperties(prefix = "docsearch")
public class DocumentSearchProperties {

    private final Embedding embedding = new Embedding();
    private final Search search = new Search();
    private final Store store = new Store();
    private final Indexing indexing = new Indexing();

    public Embedding getEmbedding() {
        return embedding;
    }

    public Search getSearch() {
        return search;
    }

    public Store getStore() {
        return store;
    }

    public Indexing getIndexing() {
        return indexing;
    }

    /**
     * Remote embedding model settings.
     */
    public static class Embedding {

        /**
         * Credential for the embedding service. Required.
         */
        private String apiKey;

        /**
         * Embedding model identifier. Required.
         */
        private String model;

        /**
         * Base URL of the OpenAI-compatible embedding endpoint.
         */
        private String baseUrl = "https://api.openai.com";

        /**
         * Number of chunks sent per embedding request.
         */
        private int batchSize = 10;

        /**
         * Attempts per batch, including the first one.
         */
        private int maxAttempts = 3;

        /**
         * Wait before the second attempt; doubled (by default) for each further attempt.
         */
        private Duration initialBackoff = Duration.ofSeconds(1);

        private double backoffMultiplier = 2.0;

        /**
         * Pause between two successful batches.
         */
        private Duration batchPause = Duration.ofMillis(100);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getBatchPause() {
            return batchPause;
        }

        public void setBatchPause(Duration batchPause) {
            this.batchPause = batchPause;
        }
    }

    public static class Search {

        /**
         * Default number of results when a query does not ask for a specific count.
         */
        private int topK = 5;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    public static class Store {

        /**
         * Vector store backend: "postgres" or "memory".
         */
        private String type = "postgres";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Indexing {

        /**
         * Whether to index the docs folder at startup.
         */
        private boolean enabled = false;

        private String docsPath = "./docs";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDocsPath() {
            return docsPath;
        }

        public void setDocsPath(String docsPath) {
            this.docsPath = docsPath;
        }
    }
}
