package dev.juridica.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.TestDatabases;
import dev.juridica.rag.chunking.Chunk;
import dev.juridica.rag.chunking.Document;
import dev.juridica.rag.embedding.DeterministicEmbeddingProvider;
import dev.juridica.rag.embedding.EmbeddingProvider;

class PersistentCollectionTest {

    private final EmbeddedDatabase database = TestDatabases.empty();

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private PersistentCollection collection(EmbeddingProvider provider) {
        IndexProperties properties = new IndexProperties();
        properties.setCollectionName("juridique");
        properties.setCollectionThreshold(0.35d);
        return new PersistentCollection(JdbcClient.create(database),
                new TransactionTemplate(new DataSourceTransactionManager(database)), provider, properties,
                new ObjectMapper());
    }

    private static Chunk chunk(String content, String source, Integer page, Map<String, Object> metadata) {
        return Chunk.of(new Document(content, source, page, metadata));
    }

    @Test
    void loadCreatesEmptyCollection() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));

        collection.load();

        assertThat(collection.size()).isZero();
        assertThat(collection.search("question", 3)).isEmpty();
    }

    @Test
    void findsUpsertedChunkBySimilarity() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));
        collection.upsert(List.of(
                chunk("Les cotisations sociales des étudiants", "guide.pdf", 3, Map.of("theme", "social")),
                chunk("Le bureau est élu par l'assemblée générale", "statuts.pdf", 1, Map.of())));

        List<RetrievedDocument> results = collection.search("Les cotisations sociales des étudiants", 3);

        assertThat(results).isNotEmpty();
        RetrievedDocument best = results.get(0);
        assertThat(best.source()).isEqualTo("guide.pdf");
        assertThat(best.page()).isEqualTo(3);
        assertThat(best.chunk().metadata()).containsEntry("theme", "social");
        assertThat(best.score()).isGreaterThan(0.99d);
        assertThat(best.origin()).isEqualTo(Origin.PERSISTENT_COLLECTION);
        assertThat(results).allSatisfy(document -> assertThat(document.rawScore()).isGreaterThanOrEqualTo(0.35d));
    }

    @Test
    void upsertReplacesChunkWithSameKey() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));
        collection.upsert(List.of(chunk("version 1", "guide.pdf", 1, Map.of())));

        collection.upsert(List.of(chunk("version 2", "guide.pdf", 1, Map.of())));

        assertThat(collection.size()).isEqualTo(1);
        assertThat(collection.search("version 2", 1)).extracting(RetrievedDocument::content)
                .containsExactly("version 2");
    }

    @Test
    void appliesMetadataFilter() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));
        collection.upsert(List.of(
                chunk("texte commun", "a.pdf", 1, Map.of("lang", "fr")),
                chunk("texte commun", "b.pdf", 2, Map.of("lang", "en")),
                chunk("texte commun", "c.pdf", null, Map.of("lang", "fr"))));

        assertThat(collection.search("texte commun", 5, 0.0d, MetadataFilter.where(MetadataFilter.SOURCE, "b.pdf")))
                .extracting(RetrievedDocument::source).containsExactly("b.pdf");
        assertThat(collection.search("texte commun", 5, 0.0d, MetadataFilter.where("lang", "fr")))
                .extracting(RetrievedDocument::source).containsExactlyInAnyOrder("a.pdf", "c.pdf");
        assertThat(collection.search("texte commun", 5, 0.0d, MetadataFilter.where(MetadataFilter.PAGE, 2)))
                .extracting(RetrievedDocument::source).containsExactly("b.pdf");
    }

    @Test
    void neverReturnsMoreThanK() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));
        collection.upsert(List.of(
                chunk("texte commun", "a.pdf", 1, Map.of()),
                chunk("texte commun", "b.pdf", 1, Map.of()),
                chunk("texte commun", "c.pdf", 1, Map.of())));

        assertThat(collection.search("texte commun", 2, 0.0d)).hasSize(2);
    }

    @Test
    void deletesChunksOfASource() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));
        collection.upsert(List.of(chunk("a", "a.pdf", 1, Map.of()), chunk("b", "b.pdf", 1, Map.of())));

        assertThat(collection.deleteBySource("a.pdf")).isEqualTo(1);
        assertThat(collection.size()).isEqualTo(1);
    }

    @Test
    void reportsEmbeddingFailureAsUnavailableBackend() {
        PersistentCollection collection = collection(StubEmbeddingProviders.failing(32));

        assertThatThrownBy(() -> collection.search("question", 3))
                .isInstanceOf(VectorBackendUnavailableException.class);
    }

    @Test
    void reportsDatabaseFailureAsUnavailableBackend() {
        PersistentCollection collection = collection(new DeterministicEmbeddingProvider(32));
        collection.load();
        database.shutdown();

        assertThatThrownBy(() -> collection.search("question", 3))
                .isInstanceOf(VectorBackendUnavailableException.class);
    }

    @Test
    @SuppressWarnings({ "unchecked", "rawtypes" })
    void pgvectorDialectDelegatesRankingToDatabase() throws SQLException {
        JdbcClient jdbcClient = mock(JdbcClient.class);
        JdbcClient.StatementSpec statement = mock(JdbcClient.StatementSpec.class);
        JdbcClient.MappedQuerySpec mapped = mock(JdbcClient.MappedQuerySpec.class);
        AtomicReference<RowMapper<?>> rowMapper = new AtomicReference<>();
        ResultSet row = mock(ResultSet.class);
        when(row.getString("content")).thenReturn("Les cotisations sociales des étudiants");
        when(row.getString("source")).thenReturn("guide.pdf");
        when(row.getObject("page", Integer.class)).thenReturn(3);
        when(row.getString("metadata")).thenReturn("{\"theme\":\"social\"}");
        when(row.getInt("total_chunks")).thenReturn(1);
        when(row.getDouble("similarity")).thenReturn(0.82d);
        when(jdbcClient.sql(anyString())).thenReturn(statement);
        when(statement.param(anyString(), any())).thenReturn(statement);
        when(statement.query(any(RowMapper.class))).thenAnswer(invocation -> {
            rowMapper.set(invocation.getArgument(0));
            return mapped;
        });
        when(mapped.list()).thenAnswer(invocation -> List.of(rowMapper.get().mapRow(row, 0)));
        IndexProperties properties = new IndexProperties();
        properties.setCollectionName("juridique");
        PersistentCollection collection = new PersistentCollection(jdbcClient, mock(TransactionTemplate.class),
                new DeterministicEmbeddingProvider(8), properties, new ObjectMapper(), VectorDialect.PGVECTOR);

        List<RetrievedDocument> results = collection.search("cotisations", 3, 0.35d,
                MetadataFilter.where("theme", "social"));

        assertThat(results).singleElement().satisfies(document -> {
            assertThat(document.source()).isEqualTo("guide.pdf");
            assertThat(document.page()).isEqualTo(3);
            assertThat(document.score()).isEqualTo(0.82d);
        });
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcClient, atLeastOnce()).sql(sql.capture());
        assertThat(sql.getAllValues()).contains("CREATE EXTENSION IF NOT EXISTS vector",
                VectorDialect.PGVECTOR.searchSql(MetadataFilter.where("theme", "social")));
        verify(statement).param("limit", 9);
        verify(statement).param("metaKey0", "theme");
        verify(statement).param("metaValue0", "social");
    }

    @Test
    void convertsVectorLiterals() {
        float[] vector = { 0.25f, -1.5f, 3.0f };

        assertThat(PersistentCollection.parseVectorLiteral(PersistentCollection.toVectorLiteral(vector)))
                .containsExactly(vector);
    }
}
