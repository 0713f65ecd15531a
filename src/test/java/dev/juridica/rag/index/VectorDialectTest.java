package dev.juridica.rag.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import dev.juridica.rag.TestDatabases;

class VectorDialectTest {

    @Test
    void pgvectorOrdersAndLimitsInDatabase() {
        String sql = VectorDialect.PGVECTOR.searchSql(
                MetadataFilter.where(MetadataFilter.SOURCE, "guide.pdf").and("theme", "social"));

        assertThat(sql)
                .contains("(1.0 - (embedding <=> :embedding::vector)) AS similarity")
                .contains("WHERE collection = :collection AND source = :source")
                .contains("AND CAST(metadata AS jsonb) ->> :metaKey0 = :metaValue0")
                .doesNotContain(":metaKey1")
                .endsWith("ORDER BY embedding <=> :embedding::vector\nLIMIT :limit");
    }

    @Test
    void pgvectorStoresVectorColumn() {
        assertThat(VectorDialect.PGVECTOR.createExtensionSql()).isEqualTo("CREATE EXTENSION IF NOT EXISTS vector");
        assertThat(VectorDialect.PGVECTOR.createTableSql()).contains("embedding vector NOT NULL");
        assertThat(VectorDialect.PGVECTOR.insertSql()).contains(":metadata, :embedding::vector)");
    }

    @Test
    void portableSelectsEveryCandidateOfTheCollection() {
        String sql = VectorDialect.PORTABLE.searchSql(MetadataFilter.where(MetadataFilter.PAGE, 2).and("lang", "fr"));

        assertThat(sql).contains(", embedding\nFROM vector_chunks").contains("AND page = :page")
                .doesNotContain("ORDER BY").doesNotContain("LIMIT").doesNotContain("jsonb");
        assertThat(VectorDialect.PORTABLE.createExtensionSql()).isNull();
        assertThat(VectorDialect.PORTABLE.createTableSql()).contains("embedding TEXT NOT NULL");
    }

    @Test
    void detectsH2AsPortable() {
        EmbeddedDatabase database = TestDatabases.empty();
        try {
            assertThat(VectorDialect.detect(database)).isEqualTo(VectorDialect.PORTABLE);
        } finally {
            database.shutdown();
        }
    }
}
