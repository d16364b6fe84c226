package com.adlanda.documentsearch.embedding;

import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.exception.ConfigurationException;
import com.adlanda.documentsearch.exception.EmbeddingGenerationException;
import com.adlanda.documentsearch.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for generating vector embeddings from text chunks.
 *
 * Chunks are sent in fixed-size batches, one batch at a time. Each batch is
 * retried with exponential backoff; a short pause separates successful
 * batches to stay under upstream rate limits. The returned vectors are in the
 * same order as the input chunks.
 */
@Service
public class EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingModelProvider modelProvider;
    private final DocumentSearchProperties.Embedding settings;
    private final Sleeper sleeper;

    @Autowired
    public EmbeddingClient(EmbeddingModelProvider modelProvider, DocumentSearchProperties properties) {
        this(modelProvider, properties, new ThreadWaitSleeper());
    }

    EmbeddingClient(EmbeddingModelProvider modelProvider, DocumentSearchProperties properties, Sleeper sleeper) {
        this.modelProvider = modelProvider;
        this.settings = properties.getEmbedding();
        this.sleeper = sleeper;
    }

    /**
     * Generates one embedding per chunk.
     *
     * @param chunks Text chunks to embed
     * @return Embedding vectors, index-aligned with {@code chunks}
     * @throws InvalidInputException if {@code chunks} is empty
     * @throws EmbeddingGenerationException if configuration is missing or a batch
     *         still fails after all attempts
     */
    public List<float[]> embed(List<String> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            log.error("Chunks list is empty");
            throw new InvalidInputException("Cannot generate embeddings for empty chunks list");
        }

        EmbeddingModel embeddingModel;
        try {
            embeddingModel = modelProvider.getModel();
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            throw new EmbeddingGenerationException("Configuration error: " + e.getMessage(), e);
        }

        int total = chunks.size();
        int batchSize = Math.max(1, settings.getBatchSize());
        int batchCount = (total + batchSize - 1) / batchSize;
        log.info("Generating embeddings for {} chunks...", total);

        List<float[]> embeddings = new ArrayList<>(total);
        for (int start = 0; start < total; start += batchSize) {
            int end = Math.min(start + batchSize, total);
            log.info("Processing batch {}/{} (chunks {}-{})", start / batchSize + 1, batchCount, start + 1, end);

            embeddings.addAll(embedBatchWithRetry(embeddingModel, List.copyOf(chunks.subList(start, end))));

            if (end < total) {
                pause(settings.getBatchPause().toMillis());
            }
        }

        log.info("Generated {} embeddings", embeddings.size());
        return embeddings;
    }

    private List<float[]> embedBatchWithRetry(EmbeddingModel embeddingModel, List<String> batch) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        long backoffMs = settings.getInitialBackoff().toMillis();

        BatchAttempt attempt = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            attempt = attemptBatch(embeddingModel, batch);
            if (attempt.succeeded()) {
                return attempt.vectors();
            }
            if (attemptNumber < maxAttempts) {
                log.warn("Embedding attempt {} failed, retrying in {}ms: {}",
                        attemptNumber, backoffMs, attempt.error().getMessage());
                pause(backoffMs);
                backoffMs = (long) (backoffMs * settings.getBackoffMultiplier());
            }
        }

        log.error("All {} embedding attempts failed: {}", maxAttempts, attempt.error().getMessage());
        throw new EmbeddingGenerationException(
                "Failed after " + maxAttempts + " attempts: " + attempt.error().getMessage(), attempt.error());
    }

    private BatchAttempt attemptBatch(EmbeddingModel embeddingModel, List<String> batch) {
        try {
            List<float[]> vectors = embeddingModel.embed(batch);
            if (vectors == null || vectors.size() != batch.size()) {
                return BatchAttempt.failure(new IllegalStateException(
                        "Expected " + batch.size() + " embeddings but received "
                                + (vectors == null ? 0 : vectors.size())));
            }
            return BatchAttempt.success(vectors);
        } catch (RuntimeException e) {
            return BatchAttempt.failure(e);
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingGenerationException("Interrupted while waiting between embedding requests", e);
        }
    }

    /**
     * Outcome of a single batch request: either the vectors or the failure.
     */
    private record BatchAttempt(List<float[]> vectors, RuntimeException error) {

        static BatchAttempt success(List<float[]> vectors) {
            return new BatchAttempt(vectors, null);
        }

        static BatchAttempt failure(RuntimeException error) {
            return new BatchAttempt(null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
