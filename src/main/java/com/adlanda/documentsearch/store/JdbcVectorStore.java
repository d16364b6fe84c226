package com.adlanda.documentsearch.store;

import com.adlanda.documentsearch.exception.DatabaseException;
import com.adlanda.documentsearch.exception.DatabaseSearchException;
import com.adlanda.documentsearch.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PostgreSQL-based vector store.
 *
 * Embeddings live in a REAL[] column next to their precomputed norm. Scoring
 * runs inside the database through the dot_product and vector_norm SQL
 * functions, so only the top-k rows travel back to the application.
 *
 * Every call borrows its own pooled connection through JdbcTemplate; the bulk
 * insert additionally runs inside a single transaction.
 */
@Repository
@ConditionalOnProperty(prefix = "docsearch.store", name = "type", havingValue = "postgres", matchIfMissing = true)
public class JdbcVectorStore extends AbstractVectorStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcVectorStore.class);

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS document_chunks (
                id SERIAL PRIMARY KEY,
                source_id VARCHAR(1024) NOT NULL,
                chunk_text TEXT NOT NULL,
                split_strategy VARCHAR(50),
                created_at TIMESTAMP DEFAULT NOW(),
                embedding REAL[] NOT NULL,
                embedding_norm REAL NOT NULL
            )
            """;

    static final String CREATE_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_document_chunks_source_id ON document_chunks (source_id)";

    static final String CREATE_DOT_PRODUCT_SQL = """
            CREATE OR REPLACE FUNCTION dot_product(a REAL[], b REAL[])
            RETURNS REAL AS $$
                SELECT SUM(ai * bi)
                FROM unnest(a) WITH ORDINALITY AS t1(ai, i)
                JOIN unnest(b) WITH ORDINALITY AS t2(bi, i) ON t1.i = t2.i
            $$ LANGUAGE SQL IMMUTABLE
            """;

    static final String CREATE_VECTOR_NORM_SQL = """
            CREATE OR REPLACE FUNCTION vector_norm(a REAL[])
            RETURNS REAL AS $$
                SELECT SQRT(SUM(ai * ai))
                FROM unnest(a) AS ai
            $$ LANGUAGE SQL IMMUTABLE
            """;

    static final String INSERT_SQL = """
            INSERT INTO document_chunks (source_id, chunk_text, split_strategy, embedding, embedding_norm)
            VALUES (?, ?, ?, ?::REAL[], COALESCE(vector_norm(?::REAL[]), 0))
            """;

    static final String DELETE_BY_SOURCE_SQL = "DELETE FROM document_chunks WHERE source_id = ?";

    static final String DELETE_ALL_SQL = "TRUNCATE TABLE document_chunks RESTART IDENTITY";

    static final String LIST_SOURCES_SQL = "SELECT DISTINCT source_id FROM document_chunks ORDER BY source_id";

    static final String COUNT_SQL = "SELECT COUNT(*) FROM document_chunks";

    static final String SIMILARITY_SQL = """
            SELECT chunk_text, source_id, split_strategy,
                   dot_product(embedding, ?::REAL[]) / (embedding_norm * ?) AS similarity_score
            FROM document_chunks
            WHERE embedding_norm > 0
            ORDER BY similarity_score DESC, id
            LIMIT ?
            """;

    private static final RowMapper<SearchResult> SEARCH_RESULT_MAPPER = (rs, rowNum) -> new SearchResult(
            rs.getString("chunk_text"),
            rs.getString("source_id"),
            rs.getString("split_strategy"),
            rs.getDouble("similarity_score")
    );

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final AtomicBoolean schemaVerified = new AtomicBoolean(false);

    public JdbcVectorStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void ensureSchema() {
        try {
            transactionTemplate.execute(status -> {
                jdbcTemplate.execute(CREATE_TABLE_SQL);
                jdbcTemplate.execute(CREATE_INDEX_SQL);
                jdbcTemplate.execute(CREATE_DOT_PRODUCT_SQL);
                jdbcTemplate.execute(CREATE_VECTOR_NORM_SQL);
                return null;
            });
            schemaVerified.set(true);
            log.info("Database schema verified.");
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to ensure database schema: {}", e.getMessage());
            throw new DatabaseException("Failed to ensure database schema: " + e.getMessage(), e);
        }
    }

    private void ensureSchemaOnce() {
        if (!schemaVerified.get()) {
            ensureSchema();
        }
    }

    @Override
    public void insertAll(String sourceId, String strategy, List<String> chunks, List<float[]> vectors) {
        validateBatch(sourceId, chunks, vectors);
        log.info("Preparing to insert {} chunks for '{}' in a single batch.", chunks.size(), sourceId);

        List<Object[]> rows = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            String literal = Vectors.toArrayLiteral(vectors.get(i));
            rows.add(new Object[]{sourceId, chunks.get(i), strategy, literal, literal});
        }

        try {
            ensureSchemaOnce();
            transactionTemplate.execute(status -> jdbcTemplate.batchUpdate(INSERT_SQL, rows));
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to store data to database for '{}': {}", sourceId, e.getMessage());
            throw new DatabaseException("Failed to store chunks for '" + sourceId + "': " + e.getMessage(), e);
        }

        log.info("Successfully stored {} chunks for '{}' in a single batch.", chunks.size(), sourceId);
    }

    @Override
    public boolean deleteBySource(String sourceId) {
        try {
            ensureSchemaOnce();
            log.info("Deleting data for source: {}", sourceId);
            int deleted = jdbcTemplate.update(DELETE_BY_SOURCE_SQL, sourceId);
            log.info("Successfully deleted {} rows for {}.", deleted, sourceId);
            return true;
        } catch (DataAccessException | DatabaseException e) {
            log.error("Failed to delete document data for '{}': {}", sourceId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean deleteAll() {
        try {
            ensureSchemaOnce();
            log.warn("Clearing all data from the document_chunks table.");
            jdbcTemplate.execute(DELETE_ALL_SQL);
            log.info("Successfully cleared all data.");
            return true;
        } catch (DataAccessException | DatabaseException e) {
            log.error("Failed to clear document data: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> listSources() {
        try {
            ensureSchemaOnce();
            List<String> sources = jdbcTemplate.queryForList(LIST_SOURCES_SQL, String.class);
            log.info("Retrieved {} unique sources from the database.", sources.size());
            return sources;
        } catch (DataAccessException e) {
            log.error("Failed to retrieve indexed sources: {}", e.getMessage());
            throw new DatabaseException("Failed to retrieve indexed sources: " + e.getMessage(), e);
        }
    }

    @Override
    public long count() {
        try {
            ensureSchemaOnce();
            Long count = jdbcTemplate.queryForObject(COUNT_SQL, Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to count stored chunks: " + e.getMessage(), e);
        }
    }

    @Override
    public List<SearchResult> findSimilar(float[] queryVector, double queryNorm, int topK) {
        try {
            ensureSchemaOnce();
            List<SearchResult> results = jdbcTemplate.query(SIMILARITY_SQL, SEARCH_RESULT_MAPPER,
                    Vectors.toArrayLiteral(queryVector), queryNorm, topK);
            log.info("Single embedding search returned {} results", results.size());
            return results;
        } catch (DataAccessException | DatabaseException e) {
            log.error("Single embedding search failed: {}", e.getMessage());
            throw new DatabaseSearchException("Failed to search database: " + e.getMessage(), e);
        }
    }
}
