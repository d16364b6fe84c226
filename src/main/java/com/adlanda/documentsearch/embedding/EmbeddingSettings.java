package com.adlanda.documentsearch.embedding;

import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.exception.ConfigurationException;

/**
 * Immutable snapshot of the settings needed to reach the embedding service.
 *
 * @param apiKey   Credential for the embedding service
 * @param model    Embedding model identifier
 * @param baseUrl  Base URL of the OpenAI-compatible endpoint
 */
public record EmbeddingSettings(
        String apiKey,
        String model,
        String baseUrl
) {
    /**
     * Validates the bound properties and freezes them.
     *
     * @throws ConfigurationException if the API key, model or base URL is missing
     */
    public static EmbeddingSettings from(DocumentSearchProperties.Embedding properties) {
        if (isBlank(properties.getApiKey())) {
            throw new ConfigurationException("docsearch.embedding.api-key is not configured");
        }
        if (isBlank(properties.getModel())) {
            throw new ConfigurationException("docsearch.embedding.model is not configured");
        }
        if (isBlank(properties.getBaseUrl())) {
            throw new ConfigurationException("docsearch.embedding.base-url is not configured");
        }
        return new EmbeddingSettings(properties.getApiKey().trim(), properties.getModel().trim(), properties.getBaseUrl().trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        // never log the credential
        return "EmbeddingSettings[model=" + model + ", baseUrl=" + baseUrl + "]";
    }
}
