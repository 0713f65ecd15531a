package dev.juridica.rag.index;

import java.sql.DatabaseMetaData;
import java.util.Locale;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

/**
 * Storage flavour of the {@code vector_chunks} table.
 * <p>
 * {@link #PGVECTOR} keeps embeddings in a pgvector column and lets PostgreSQL
 * order candidates by cosine distance. {@link #PORTABLE} keeps the vector
 * literal as text and ranks in memory, which is what H2 needs.
 */
public enum VectorDialect {

    PGVECTOR("vector", ":embedding::vector"),
    PORTABLE("TEXT", ":embedding");

    private static final Logger LOGGER = LoggerFactory.getLogger(VectorDialect.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS vector_chunks (
              collection VARCHAR(128) NOT NULL,
              chunk_key VARCHAR(1024) NOT NULL,
              content TEXT NOT NULL,
              source VARCHAR(1024) NOT NULL,
              page INTEGER,
              chunk_id INTEGER NOT NULL,
              total_chunks INTEGER NOT NULL,
              merged BOOLEAN NOT NULL,
              chunk_ids TEXT,
              metadata TEXT,
              embedding %s NOT NULL,
              PRIMARY KEY (collection, chunk_key)
            )
            """;

    private static final String INSERT_SQL = """
            INSERT INTO vector_chunks
              (collection, chunk_key, content, source, page, chunk_id, total_chunks, merged, chunk_ids, metadata,
               embedding)
            VALUES
              (:collection, :chunkKey, :content, :source, :page, :chunkId, :totalChunks, :merged, :chunkIds,
               :metadata, %s)
            """;

    private static final String COLUMNS = "content, source, page, chunk_id, total_chunks, merged, chunk_ids, metadata";

    private final String columnType;
    private final String embeddingParameter;

    VectorDialect(String columnType, String embeddingParameter) {
        this.columnType = columnType;
        this.embeddingParameter = embeddingParameter;
    }

    /**
     * Picks {@link #PGVECTOR} for PostgreSQL and {@link #PORTABLE} for
     * anything else, including H2 in PostgreSQL compatibility mode.
     */
    public static VectorDialect detect(DataSource dataSource) {
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource,
                    DatabaseMetaData::getDatabaseProductName);
            VectorDialect dialect = product != null && product.toLowerCase(Locale.ROOT).contains("postgres")
                    ? PGVECTOR : PORTABLE;
            LOGGER.info("Vector chunks stored with the {} dialect on {}", dialect, product);
            return dialect;
        } catch (MetaDataAccessException ex) {
            LOGGER.warn("Unable to detect the database product, using the portable dialect: {}", ex.getMessage());
            return PORTABLE;
        }
    }

    /**
     * Whether the database ranks candidates itself.
     */
    public boolean ranksInDatabase() {
        return this == PGVECTOR;
    }

    String createExtensionSql() {
        return this == PGVECTOR ? "CREATE EXTENSION IF NOT EXISTS vector" : null;
    }

    String createTableSql() {
        return CREATE_TABLE_SQL.formatted(columnType);
    }

    String insertSql() {
        return INSERT_SQL.formatted(embeddingParameter);
    }

    /**
     * Select statement for the filter. Source and page become column
     * predicates. The pgvector dialect compares the remaining
     * {@link MetadataFilter#metadataEqualities() metadata predicates} on the
     * JSON document, bound as {@code metaKey<i>} and {@code metaValue<i>}, and
     * returns the similarity ordered best first, limited to {@code :limit}
     * rows.
     */
    String searchSql(MetadataFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS);
        if (this == PGVECTOR) {
            sql.append(", (1.0 - (embedding <=> :embedding::vector)) AS similarity");
        } else {
            sql.append(", embedding");
        }
        sql.append("\nFROM vector_chunks\nWHERE collection = :collection");
        if (filter.source() != null) {
            sql.append(" AND source = :source");
        }
        if (filter.page() != null) {
            sql.append(" AND page = :page");
        }
        if (this == PGVECTOR) {
            for (int i = 0; i < filter.metadataEqualities().size(); i++) {
                sql.append(" AND CAST(metadata AS jsonb) ->> :metaKey").append(i)
                        .append(" = :metaValue").append(i);
            }
            sql.append("\nORDER BY embedding <=> :embedding::vector\nLIMIT :limit");
        }
        return sql.toString();
    }
}
