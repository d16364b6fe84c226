package com.adlanda.documentsearch.embedding;

import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.exception.ConfigurationException;
import com.adlanda.documentsearch.exception.EmbeddingGenerationException;
import com.adlanda.documentsearch.exception.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.retry.backoff.Sleeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingClientTest {

    @Mock
    private EmbeddingModelProvider modelProvider;

    @Mock
    private EmbeddingModel embeddingModel;

    private final List<Long> sleeps = new ArrayList<>();

    private EmbeddingClient embeddingClient;

    @BeforeEach
    void setUp() {
        Sleeper recordingSleeper = sleeps::add;
        embeddingClient = new EmbeddingClient(modelProvider, new DocumentSearchProperties(), recordingSleeper);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 10, 11, 25})
    void embed_anyChunkCount_returnsVectorsInInputOrder(int count) {
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList())).thenAnswer(invocation -> indexVectors(invocation.getArgument(0)));

        List<float[]> vectors = embeddingClient.embed(chunks(count));

        assertThat(vectors).hasSize(count);
        for (int i = 0; i < count; i++) {
            assertThat(vectors.get(i)[0]).isEqualTo((float) i);
        }

        int batches = (count + 9) / 10;
        verify(embeddingModel, times(batches)).embed(anyList());
        assertThat(sleeps).isEqualTo(Collections.nCopies(batches - 1, 100L));
    }

    @Test
    void embed_batchesAreAtMostTenChunks() {
        List<Integer> batchSizes = new ArrayList<>();
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList())).thenAnswer(invocation -> {
            List<String> batch = invocation.getArgument(0);
            batchSizes.add(batch.size());
            return indexVectors(batch);
        });

        embeddingClient.embed(chunks(25));

        assertThat(batchSizes).containsExactly(10, 10, 5);
    }

    @Test
    void embed_transientFailures_retriesWithExponentialBackoff() {
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList()))
                .thenThrow(new RuntimeException("rate limited"))
                .thenThrow(new RuntimeException("rate limited"))
                .thenAnswer(invocation -> indexVectors(invocation.getArgument(0)));

        List<float[]> vectors = embeddingClient.embed(chunks(3));

        assertThat(vectors).hasSize(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
        verify(embeddingModel, times(3)).embed(anyList());
    }

    @Test
    void embed_allAttemptsFail_throwsEmbeddingGenerationException() {
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList())).thenThrow(new RuntimeException("service unavailable"));

        assertThatThrownBy(() -> embeddingClient.embed(chunks(3)))
                .isInstanceOf(EmbeddingGenerationException.class)
                .hasMessage("Failed after 3 attempts: service unavailable");

        verify(embeddingModel, times(3)).embed(anyList());
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    void embed_failureInLaterBatch_stopsWithoutFurtherBatches() {
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList()))
                .thenAnswer(invocation -> indexVectors(invocation.getArgument(0)))
                .thenThrow(new RuntimeException("boom"));

        assertThatThrownBy(() -> embeddingClient.embed(chunks(25)))
                .isInstanceOf(EmbeddingGenerationException.class);

        // one successful batch, then three attempts at the second
        verify(embeddingModel, times(4)).embed(anyList());
        assertThat(sleeps).containsExactly(100L, 1000L, 2000L);
    }

    @Test
    void embed_responseSizeMismatch_isRetriedThenFails() {
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new float[]{1f}));

        assertThatThrownBy(() -> embeddingClient.embed(chunks(2)))
                .isInstanceOf(EmbeddingGenerationException.class)
                .hasMessageContaining("Expected 2 embeddings but received 1");

        verify(embeddingModel, times(3)).embed(anyList());
    }

    @Test
    void embed_missingConfiguration_throwsEmbeddingGenerationException() {
        when(modelProvider.getModel())
                .thenThrow(new ConfigurationException("docsearch.embedding.api-key is not configured"));

        assertThatThrownBy(() -> embeddingClient.embed(chunks(1)))
                .isInstanceOf(EmbeddingGenerationException.class)
                .hasMessage("Configuration error: docsearch.embedding.api-key is not configured")
                .hasCauseInstanceOf(ConfigurationException.class);
    }

    @Test
    void embed_emptyList_throwsInvalidInput() {
        assertThatThrownBy(() -> embeddingClient.embed(List.of()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Cannot generate embeddings for empty chunks list");

        verify(modelProvider, never()).getModel();
    }

    @Test
    void embed_interruptedDuringBackoff_restoresInterruptFlag() {
        embeddingClient = new EmbeddingClient(modelProvider, new DocumentSearchProperties(), millis -> {
            throw new InterruptedException();
        });
        when(modelProvider.getModel()).thenReturn(embeddingModel);
        when(embeddingModel.embed(anyList())).thenThrow(new RuntimeException("rate limited"));

        try {
            assertThatThrownBy(() -> embeddingClient.embed(chunks(1)))
                    .isInstanceOf(EmbeddingGenerationException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    private static List<String> chunks(int count) {
        return IntStream.range(0, count).mapToObj(i -> "chunk-" + i).toList();
    }

    // vector [i] for text "chunk-i", so order can be checked after batching
    private static List<float[]> indexVectors(List<String> batch) {
        return batch.stream()
                .map(text -> new float[]{Float.parseFloat(text.substring("chunk-".length())), 1f})
                .toList();
    }
}
