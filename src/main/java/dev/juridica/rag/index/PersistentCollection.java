package dev.juridica.rag.index;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.chunking.Chunk;
import dev.juridica.rag.embedding.EmbeddingProvider;
import dev.juridica.rag.embedding.Vectors;

/**
 * Durable collection of embedded chunks stored in the {@code vector_chunks}
 * table. Chunks are upserted one by one without rebuilding the collection and
 * can be searched with metadata predicates. With the
 * {@link VectorDialect#PGVECTOR pgvector dialect} PostgreSQL orders the
 * candidates by cosine distance and returns at most the oversampled window;
 * otherwise they are ranked in memory. Any failure of the database or of
 * the embedding service surfaces as {@link VectorBackendUnavailableException}
 * so that retrieval can fall back to another backend.
 */
public class PersistentCollection implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(PersistentCollection.class);

    private static final String DELETE_SQL = """
            DELETE FROM vector_chunks
            WHERE collection = :collection AND chunk_key = :chunkKey
            """;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Integer>> CHUNK_IDS_TYPE = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final EmbeddingProvider embeddingProvider;
    private final ObjectMapper objectMapper;
    private final String collection;
    private final double threshold;
    private final VectorDialect dialect;
    private volatile boolean tableReady;

    public PersistentCollection(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            EmbeddingProvider embeddingProvider, IndexProperties properties, ObjectMapper objectMapper) {
        this(jdbcClient, transactionTemplate, embeddingProvider, properties, objectMapper, VectorDialect.PORTABLE);
    }

    public PersistentCollection(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            EmbeddingProvider embeddingProvider, IndexProperties properties, ObjectMapper objectMapper,
            VectorDialect dialect) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.collection = properties.getCollectionName();
        this.threshold = properties.getCollectionThreshold();
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public void upsert(List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        ensureTable();
        List<float[]> embeddings = embed(chunks.stream().map(Chunk::content).toList());
        List<ChunkRow> rows = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            rows.add(toRow(chunks.get(i), embeddings.get(i)));
        }
        try {
            transactionTemplate.executeWithoutResult(status -> rows.forEach(this::replace));
        } catch (DataAccessException | TransactionException ex) {
            throw new VectorBackendUnavailableException("Unable to upsert into collection " + collection, ex);
        }
        LOGGER.info("Upserted {} chunks into collection {}", rows.size(), collection);
    }

    @Override
    public List<RetrievedDocument> search(String query, int k, double minSimilarity) {
        return search(query, k, minSimilarity, MetadataFilter.none());
    }

    /**
     * Searches the chunks matching the filter. Similarity is {@code 1 - cosine
     * distance} clamped to [0, 1] and must reach {@code minSimilarity}.
     */
    public List<RetrievedDocument> search(String query, int k, double minSimilarity, MetadataFilter filter) {
        if (k <= 0) {
            return List.of();
        }
        ensureTable();
        float[] queryVector = embed(List.of(query)).get(0);
        List<RetrievedDocument> ranked;
        try {
            ranked = dialect.ranksInDatabase()
                    ? rankInDatabase(queryVector, k * SearchCandidates.OVERSAMPLING, filter)
                    : rankInMemory(queryVector, filter);
        } catch (DataAccessException ex) {
            throw new VectorBackendUnavailableException("Unable to search collection " + collection, ex);
        }
        return SearchCandidates.select(ranked, k, minSimilarity, comparator());
    }

    /**
     * Removes every chunk of a source, e.g. before re-indexing it.
     *
     * @return the number of deleted chunks
     */
    public int deleteBySource(String source) {
        ensureTable();
        try {
            return jdbcClient.sql("DELETE FROM vector_chunks WHERE collection = :collection AND source = :source")
                    .param("collection", collection)
                    .param("source", source)
                    .update();
        } catch (DataAccessException ex) {
            throw new VectorBackendUnavailableException("Unable to delete from collection " + collection, ex);
        }
    }

    @Override
    public void persist() {
        LOGGER.debug("Collection {} commits on every upsert, nothing to persist", collection);
    }

    /**
     * Creates the backing table when absent. An empty collection is a valid
     * state.
     */
    @Override
    public void load() {
        tableReady = false;
        ensureTable();
    }

    @Override
    public Origin origin() {
        return Origin.PERSISTENT_COLLECTION;
    }

    @Override
    public int size() {
        ensureTable();
        try {
            return jdbcClient.sql("SELECT COUNT(*) FROM vector_chunks WHERE collection = :collection")
                    .param("collection", collection)
                    .query(Integer.class)
                    .single();
        } catch (DataAccessException ex) {
            throw new VectorBackendUnavailableException("Unable to count collection " + collection, ex);
        }
    }

    @Override
    public ScoreComparator comparator() {
        return ScoreComparator.MIN_SIMILARITY;
    }

    @Override
    public double defaultThreshold() {
        return threshold;
    }

    private void ensureTable() {
        if (tableReady) {
            return;
        }
        try {
            if (dialect.createExtensionSql() != null) {
                jdbcClient.sql(dialect.createExtensionSql()).update();
            }
            jdbcClient.sql(dialect.createTableSql()).update();
            tableReady = true;
        } catch (DataAccessException ex) {
            throw new VectorBackendUnavailableException("Unable to create collection " + collection, ex);
        }
    }

    private List<float[]> embed(List<String> texts) {
        List<float[]> vectors;
        try {
            vectors = embeddingProvider.embedAll(texts);
        } catch (RuntimeException ex) {
            throw new VectorBackendUnavailableException("Embedding failed for collection " + collection, ex);
        }
        List<float[]> normalized = new ArrayList<>(vectors.size());
        vectors.forEach(vector -> normalized.add(Vectors.normalize(vector.clone())));
        return normalized;
    }

    private List<RetrievedDocument> rankInDatabase(float[] queryVector, int limit, MetadataFilter filter) {
        return statement(filter)
                .param("embedding", toVectorLiteral(queryVector))
                .param("limit", limit)
                .query((rs, rowNum) -> {
                    double similarity = RetrievedDocument.clamp(rs.getDouble("similarity"));
                    return new RetrievedDocument(mapChunk(rs), similarity, similarity,
                            Origin.PERSISTENT_COLLECTION);
                })
                .list();
    }

    private List<RetrievedDocument> rankInMemory(float[] queryVector, MetadataFilter filter) {
        List<RetrievedDocument> ranked = new ArrayList<>();
        List<StoredChunk> stored = statement(filter)
                .query((rs, rowNum) -> new StoredChunk(mapChunk(rs), parseVectorLiteral(rs.getString("embedding"))))
                .list();
        for (StoredChunk candidate : stored) {
            if (!filter.matchesMetadata(candidate.chunk())) {
                continue;
            }
            double distance = 1.0d - Vectors.dot(queryVector, candidate.embedding());
            double similarity = RetrievedDocument.clamp(1.0d - distance);
            ranked.add(new RetrievedDocument(candidate.chunk(), similarity, similarity,
                    Origin.PERSISTENT_COLLECTION));
        }
        ranked.sort(Comparator.comparingDouble(RetrievedDocument::rawScore).reversed());
        return ranked;
    }

    private JdbcClient.StatementSpec statement(MetadataFilter filter) {
        JdbcClient.StatementSpec statement = jdbcClient.sql(dialect.searchSql(filter))
                .param("collection", collection);
        if (filter.source() != null) {
            statement = statement.param("source", String.valueOf(filter.source()));
        }
        if (filter.page() != null) {
            statement = statement.param("page", Integer.valueOf(String.valueOf(filter.page())));
        }
        if (dialect.ranksInDatabase()) {
            int i = 0;
            for (Map.Entry<String, Object> entry : filter.metadataEqualities().entrySet()) {
                statement = statement.param("metaKey" + i, entry.getKey())
                        .param("metaValue" + i, String.valueOf(entry.getValue()));
                i++;
            }
        }
        return statement;
    }

    private void replace(ChunkRow row) {
        jdbcClient.sql(DELETE_SQL)
                .param("collection", collection)
                .param("chunkKey", row.chunk().key())
                .update();
        jdbcClient.sql(dialect.insertSql())
                .param("collection", collection)
                .param("chunkKey", row.chunk().key())
                .param("content", row.chunk().content())
                .param("source", row.chunk().source())
                .param("page", row.chunk().page())
                .param("chunkId", row.chunk().chunkId())
                .param("totalChunks", row.chunk().totalChunks())
                .param("merged", row.chunk().merged())
                .param("chunkIds", row.chunkIdsJson())
                .param("metadata", row.metadataJson())
                .param("embedding", toVectorLiteral(row.embedding()))
                .update();
    }

    private ChunkRow toRow(Chunk chunk, float[] embedding) {
        try {
            String chunkIds = chunk.chunkIds() == null ? null : objectMapper.writeValueAsString(chunk.chunkIds());
            return new ChunkRow(chunk, embedding, chunkIds, objectMapper.writeValueAsString(chunk.metadata()));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Chunk metadata of " + chunk.key() + " is not serializable", ex);
        }
    }

    private Chunk mapChunk(ResultSet rs) throws SQLException {
        try {
            String chunkIds = rs.getString("chunk_ids");
            String metadata = rs.getString("metadata");
            return new Chunk(
                    rs.getString("content"),
                    rs.getString("source"),
                    rs.getObject("page", Integer.class),
                    metadata == null ? Map.of() : objectMapper.readValue(metadata, METADATA_TYPE),
                    rs.getInt("chunk_id"),
                    rs.getInt("total_chunks"),
                    rs.getBoolean("merged"),
                    chunkIds == null ? null : objectMapper.readValue(chunkIds, CHUNK_IDS_TYPE));
        } catch (JsonProcessingException ex) {
            throw new SQLException("Corrupt chunk row in collection " + collection, ex);
        }
    }

    static String toVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parseVectorLiteral(String literal) {
        String body = literal.strip();
        if (body.startsWith("[") && body.endsWith("]")) {
            body = body.substring(1, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].strip());
        }
        return vector;
    }

    private record ChunkRow(Chunk chunk, float[] embedding, String chunkIdsJson, String metadataJson) {
    }

    private record StoredChunk(Chunk chunk, float[] embedding) {
    }
}
