package com.adlanda.documentsearch.model;

import java.util.List;

/**
 * Summary of indexing every supported document in a folder.
 *
 * @param folder          The folder that was scanned
 * @param documentsFound  Number of supported documents found
 * @param outcomes        One outcome per document, in processing order
 */
public record FolderIndexingSummary(
        String folder,
        int documentsFound,
        List<IndexingOutcome> outcomes
) {
    public int succeeded() {
        return (int) outcomes.stream().filter(IndexingOutcome::success).count();
    }

    public int failed() {
        return outcomes.size() - succeeded();
    }

    public int totalChunks() {
        return outcomes.stream().mapToInt(IndexingOutcome::chunkCount).sum();
    }
}
