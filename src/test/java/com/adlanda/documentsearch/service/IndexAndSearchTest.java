package com.adlanda.documentsearch.service;

import com.adlanda.documentsearch.chunking.ParagraphChunker;
import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.embedding.EmbeddingClient;
import com.adlanda.documentsearch.embedding.EmbeddingModelProvider;
import com.adlanda.documentsearch.embedding.EmbeddingSettings;
import com.adlanda.documentsearch.model.FolderIndexingSummary;
import com.adlanda.documentsearch.model.IndexingOutcome;
import com.adlanda.documentsearch.model.QueryResponse;
import com.adlanda.documentsearch.model.SearchResult;
import com.adlanda.documentsearch.search.SimilaritySearchEngine;
import com.adlanda.documentsearch.store.InMemoryVectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.embedding.EmbeddingModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Indexes real files and searches them through the full pipeline, with an
 * in-memory store and a word-count embedding model.
 */
class IndexAndSearchTest {

    private static final List<String> VOCABULARY = List.of(
            "cats", "purr", "sleep", "rust", "memory", "safety", "compiler", "rain", "clouds");

    @TempDir
    Path docsDir;

    private InMemoryVectorStore vectorStore;
    private IndexingService indexingService;
    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        DocumentSearchProperties properties = new DocumentSearchProperties();
        properties.getEmbedding().setApiKey("test-key");
        properties.getEmbedding().setModel("bag-of-words");
        properties.getEmbedding().setBatchPause(Duration.ZERO);

        EmbeddingModel model = new BagOfWordsEmbeddingModel(VOCABULARY);
        EmbeddingModelProvider provider = new EmbeddingModelProvider(properties) {
            @Override
            protected EmbeddingModel createModel(EmbeddingSettings settings) {
                return model;
            }
        };

        ParagraphChunker chunker = new ParagraphChunker();
        EmbeddingClient embeddingClient = new EmbeddingClient(provider, properties);
        vectorStore = new InMemoryVectorStore();

        indexingService = new IndexingService(new PlainTextExtractor(), chunker, embeddingClient, vectorStore);
        retrievalService = new RetrievalService(chunker, embeddingClient, new SimilaritySearchEngine(vectorStore),
                vectorStore, new SearchResultFormatter(), properties);
    }

    @Test
    void query_matchingSecondParagraph_ranksItFirst() throws IOException {
        Path doc = Files.writeString(docsDir.resolve("notes.md"), """
                Cats purr when they are content and sleep most of the day.

                Rust gives memory safety through its compiler.
                """);

        IndexingOutcome outcome = indexingService.indexDocument(doc);
        QueryResponse response = retrievalService.query("How does the compiler give memory safety?", 2);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.chunkCount()).isEqualTo(2);
        assertThat(response.totalChunks()).isEqualTo(2);
        assertThat(response.results().get(0).chunkText()).startsWith("Rust gives memory safety");
        assertThat(response.results().get(0).score()).isGreaterThan(response.results().get(1).score());
        assertThat(response.results().get(0).sourceId()).isEqualTo(doc.toString());
    }

    @Test
    void indexDocument_twice_keepsSingleGeneration() throws IOException {
        Path doc = Files.writeString(docsDir.resolve("notes.txt"), "Cats purr.\n\nRain falls from clouds.");

        indexingService.indexDocument(doc);
        indexingService.indexDocument(doc);

        assertThat(vectorStore.count()).isEqualTo(2);
        assertThat(vectorStore.listSources()).containsExactly(doc.toString());
    }

    @Test
    void indexDocument_changedContent_replacesOldChunks() throws IOException {
        Path doc = Files.writeString(docsDir.resolve("notes.txt"), "Cats purr.\n\nCats sleep.\n\nRain falls.");
        indexingService.indexDocument(doc);

        Files.writeString(doc, "Rust compiler.");
        indexingService.indexDocument(doc);

        List<SearchResult> results = retrievalService.query("cats purr", 5).results();
        assertThat(vectorStore.count()).isEqualTo(1);
        assertThat(results).extracting(SearchResult::chunkText).containsExactly("Rust compiler.");
    }

    @Test
    void query_withoutKnownWords_returnsNoResults() throws IOException {
        Path doc = Files.writeString(docsDir.resolve("notes.md"), "Cats purr.");
        indexingService.indexDocument(doc);

        assertThat(retrievalService.query("completely unrelated words", 5).results()).isEmpty();
    }

    @Test
    void query_multiParagraphQuestion_coversBothTopics() throws IOException {
        Files.writeString(docsDir.resolve("a.md"), "Cats purr and sleep.\n\nRain comes from clouds.");
        Files.writeString(docsDir.resolve("b.md"), "Rust has a strict compiler.");
        indexingService.indexFolder(docsDir);

        List<SearchResult> results = retrievalService.query("Why do cats purr?\n\nWhat does the rust compiler do?", 2)
                .results();

        assertThat(results).extracting(SearchResult::chunkText)
                .containsExactly("Cats purr and sleep.", "Rust has a strict compiler.");
    }

    @Test
    void indexFolder_skipsUnsupportedAndReportsFailures() throws IOException {
        Files.writeString(docsDir.resolve("a.md"), "Cats purr.");
        Files.writeString(docsDir.resolve("b.txt"), "   ");
        Files.writeString(docsDir.resolve("c.xlsx"), "not read");

        FolderIndexingSummary summary = indexingService.indexFolder(docsDir);

        assertThat(summary.documentsFound()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(vectorStore.listSources()).containsExactly(docsDir.resolve("a.md").toString());
    }
}
