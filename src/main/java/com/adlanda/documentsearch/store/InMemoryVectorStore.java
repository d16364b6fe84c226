package com.adlanda.documentsearch.store;

import com.adlanda.documentsearch.model.EmbeddingRecord;
import com.adlanda.documentsearch.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Simple in-memory vector store.
 *
 * Keeps records in insertion order, which doubles as the tie-break order for
 * equal scores. Enabled with docsearch.store.type=memory; useful for local
 * runs without PostgreSQL and for tests.
 */
@Repository
@ConditionalOnProperty(prefix = "docsearch.store", name = "type", havingValue = "memory")
public class InMemoryVectorStore extends AbstractVectorStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final List<EmbeddingRecord> records = new ArrayList<>();

    @Override
    public void ensureSchema() {
        // nothing to create
    }

    @Override
    public void insertAll(String sourceId, String strategy, List<String> chunks, List<float[]> vectors) {
        validateBatch(sourceId, chunks, vectors);

        List<EmbeddingRecord> batch = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            float[] vector = vectors.get(i).clone();
            batch.add(new EmbeddingRecord(sourceId, chunks.get(i), strategy, vector, Vectors.norm(vector)));
        }

        synchronized (records) {
            records.addAll(batch);
        }
        log.info("Stored {} chunks for '{}' in vector store", batch.size(), sourceId);
    }

    @Override
    public boolean deleteBySource(String sourceId) {
        int removed;
        synchronized (records) {
            int before = records.size();
            records.removeIf(record -> record.sourceId().equals(sourceId));
            removed = before - records.size();
        }
        log.info("Deleted {} records for {}", removed, sourceId);
        return true;
    }

    @Override
    public boolean deleteAll() {
        synchronized (records) {
            records.clear();
        }
        log.warn("Cleared all records from vector store");
        return true;
    }

    @Override
    public List<String> listSources() {
        TreeSet<String> sources = new TreeSet<>();
        synchronized (records) {
            records.forEach(record -> sources.add(record.sourceId()));
        }
        return List.copyOf(sources);
    }

    @Override
    public long count() {
        synchronized (records) {
            return records.size();
        }
    }

    @Override
    public List<SearchResult> findSimilar(float[] queryVector, double queryNorm, int topK) {
        List<EmbeddingRecord> snapshot;
        synchronized (records) {
            snapshot = List.copyOf(records);
        }

        // stable sort keeps insertion order among equal scores
        return snapshot.stream()
                .filter(EmbeddingRecord::isScorable)
                .map(record -> new SearchResult(
                        record.chunkText(),
                        record.sourceId(),
                        record.strategy(),
                        Vectors.dot(queryVector, record.embedding()) / (record.norm() * queryNorm)))
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
                .limit(topK)
                .toList();
    }
}
