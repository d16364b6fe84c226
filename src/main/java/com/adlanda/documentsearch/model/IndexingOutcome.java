package com.adlanda.documentsearch.model;

/**
 * Terminal state of indexing one document.
 *
 * @param sourceId    The document's source identifier
 * @param success     True when every pipeline step completed
 * @param chunkCount  Number of chunks written (0 on failure)
 * @param error       Cause of the failure, null on success
 */
public record IndexingOutcome(
        String sourceId,
        boolean success,
        int chunkCount,
        String error
) {
    public static IndexingOutcome succeeded(String sourceId, int chunkCount) {
        return new IndexingOutcome(sourceId, true, chunkCount, null);
    }

    public static IndexingOutcome failed(String sourceId, String error) {
        return new IndexingOutcome(sourceId, false, 0, error);
    }
}
