package com.adlanda.documentsearch.embedding;

import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds the Spring AI embedding model on first use and keeps it for the
 * lifetime of the process.
 *
 * Settings are validated lazily so the application can start (and serve
 * inventory or delete requests) without embedding credentials.
 */
@Component
public class EmbeddingModelProvider {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingModelProvider.class);

    // EmbeddingClient owns the retry budget; Spring AI makes a single attempt.
    private static final RetryTemplate SINGLE_ATTEMPT = RetryTemplate.builder()
            .maxAttempts(1)
            .build();

    private final DocumentSearchProperties properties;

    private volatile EmbeddingModel embeddingModel;

    public EmbeddingModelProvider(DocumentSearchProperties properties) {
        this.properties = properties;
    }

    /**
     * Returns the cached embedding model, creating it on the first call.
     *
     * @throws ConfigurationException if required settings are missing
     */
    public EmbeddingModel getModel() {
        EmbeddingModel model = embeddingModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (embeddingModel == null) {
                EmbeddingSettings settings = EmbeddingSettings.from(properties.getEmbedding());
                embeddingModel = createModel(settings);
                log.info("Configuration loaded successfully: {}", settings);
            }
            return embeddingModel;
        }
    }

    protected EmbeddingModel createModel(EmbeddingSettings settings) {
        OpenAiApi openAiApi = OpenAiApi.builder()
                .apiKey(settings.apiKey())
                .baseUrl(settings.baseUrl())
                .build();

        OpenAiEmbeddingOptions options = OpenAiEmbeddingOptions.builder()
                .model(settings.model())
                .build();

        return new OpenAiEmbeddingModel(openAiApi, MetadataMode.EMBED, options, SINGLE_ATTEMPT);
    }
}
