package com.adlanda.documentsearch.service;

import com.adlanda.documentsearch.chunking.ParagraphChunker;
import com.adlanda.documentsearch.embedding.EmbeddingClient;
import com.adlanda.documentsearch.exception.DocumentProcessingException;
import com.adlanda.documentsearch.exception.DocumentSearchException;
import com.adlanda.documentsearch.exception.ValidationException;
import com.adlanda.documentsearch.model.Chunk;
import com.adlanda.documentsearch.model.FolderIndexingSummary;
import com.adlanda.documentsearch.model.IndexingOutcome;
import com.adlanda.documentsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs documents through the indexing pipeline:
 * 1. Delete the document's existing records
 * 2. Extract its text
 * 3. Split into paragraph chunks
 * 4. Embed the chunks
 * 5. Write chunks and embeddings in one batch
 *
 * Re-indexing a document therefore replaces it rather than duplicating it.
 * A failing step stops the pipeline for that document only.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final TextExtractor textExtractor;
    private final ParagraphChunker chunker;
    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;

    public IndexingService(TextExtractor textExtractor,
                           ParagraphChunker chunker,
                           EmbeddingClient embeddingClient,
                           VectorStore vectorStore) {
        this.textExtractor = textExtractor;
        this.chunker = chunker;
        this.embeddingClient = embeddingClient;
        this.vectorStore = vectorStore;
    }

    /**
     * Indexes one document, replacing any earlier generation of its records.
     *
     * @param file Path of the document; its string form is the source identifier
     * @return The terminal outcome; failures carry the cause instead of throwing
     */
    public IndexingOutcome indexDocument(Path file) {
        String sourceId = file.toString();
        log.info("Starting document processing pipeline for: {}", sourceId);

        log.info("Clearing any existing data for '{}' before indexing.", sourceId);
        if (!vectorStore.deleteBySource(sourceId)) {
            log.error("Failed to clear old data for '{}'. Aborting.", sourceId);
            return IndexingOutcome.failed(sourceId, "Failed to clear existing data");
        }

        try {
            // text, chunks and vectors are local to the step helpers and
            // become unreachable as soon as their consumer returns
            List<Chunk> chunks = extractChunks(file, sourceId);
            int chunkCount = embedAndStore(sourceId, chunks);

            log.info("Document processing completed successfully for: {}", sourceId);
            return IndexingOutcome.succeeded(sourceId, chunkCount);
        } catch (DocumentSearchException e) {
            log.error("A known error occurred during document processing of '{}': {}", sourceId, e.getMessage());
            return IndexingOutcome.failed(sourceId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("An unexpected error occurred processing document '{}'", sourceId, e);
            return IndexingOutcome.failed(sourceId, "Unexpected error: " + e.getMessage());
        }
    }

    private List<Chunk> extractChunks(Path file, String sourceId) {
        String text = textExtractor.extract(file);
        return chunker.chunkDocument(sourceId, text);
    }

    private int embedAndStore(String sourceId, List<Chunk> chunks) {
        List<String> texts = chunks.stream().map(Chunk::text).toList();
        List<float[]> embeddings = embeddingClient.embed(texts);
        vectorStore.insertAll(sourceId, chunks.get(0).strategy(), texts, embeddings);
        return texts.size();
    }

    /**
     * Indexes every supported document directly inside a folder, in name order.
     * One failing document does not stop the others.
     *
     * @param folder Folder to scan (not recursive)
     * @return Per-document outcomes
     * @throws ValidationException if the path is not a folder
     * @throws DocumentProcessingException if the folder cannot be listed
     */
    public FolderIndexingSummary indexFolder(Path folder) {
        List<Path> documents = listSupportedDocuments(folder);
        log.info("Found {} supported documents in {}. Starting processing...", documents.size(), folder);

        List<IndexingOutcome> outcomes = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            log.info("Processing file {} of {}...", i + 1, documents.size());
            outcomes.add(indexDocument(documents.get(i)));
        }

        FolderIndexingSummary summary = new FolderIndexingSummary(folder.toString(), documents.size(), outcomes);
        log.info("Folder processing complete: {} succeeded, {} failed, {} chunks indexed",
                summary.succeeded(), summary.failed(), summary.totalChunks());
        return summary;
    }

    List<Path> listSupportedDocuments(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new ValidationException("Not a folder: " + folder);
        }
        try (Stream<Path> paths = Files.list(folder)) {
            return paths.filter(Files::isRegularFile)
                    .filter(textExtractor::supports)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new DocumentProcessingException("Cannot list folder " + folder + ": " + e.getMessage(), e);
        }
    }
}
