package dev.juridica.rag.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.MutableClock;
import dev.juridica.rag.TestDatabases;
import dev.juridica.rag.retrieval.Excerpt;

class ConversationRepositoryTest {

    private final EmbeddedDatabase database = TestDatabases.withSchema();
    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final ConversationRepository repository = new ConversationRepository(JdbcClient.create(database),
            new TransactionTemplate(new DataSourceTransactionManager(database)), new ObjectMapper(), clock);

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static ExchangeRecord exchange(String conversationId, String question, String answer) {
        return new ExchangeRecord(conversationId, 7L, question, answer, List.of("statuts.pdf (page 3)"),
                List.of(new Excerpt("Le trésorier tient les comptes.", "statuts.pdf", 3)), "legal");
    }

    @Test
    void autoCreatesConversationOnFirstExchange() {
        StoredExchange first = repository.saveExchange(exchange("conv-1", "Qui tient les comptes ?", "Le trésorier."),
                PersistMode.AUTO_CREATE);
        clock.advance(Duration.ofMinutes(1));
        StoredExchange second = repository.saveExchange(exchange("conv-1", "Et qui le contrôle ?", "L'assemblée."),
                PersistMode.CONTINUE_EXISTING);

        assertThat(first.firstExchange()).isTrue();
        assertThat(second.firstExchange()).isFalse();
        assertThat(second.conversationRowId()).isEqualTo(first.conversationRowId());
        assertThat(second.questionId()).isGreaterThan(first.questionId());
        assertThat(repository.exists("conv-1")).isTrue();
    }

    @Test
    void returnsHistoryOldestFirstWithSourcesAndExcerpts() {
        repository.saveExchange(exchange("conv-2", "Q1", "A1"), PersistMode.AUTO_CREATE);
        clock.advance(Duration.ofSeconds(30));
        repository.saveExchange(exchange("conv-2", "Q2", "A2"), PersistMode.CONTINUE_EXISTING);

        List<StoredTurn> history = repository.findHistory("conv-2").orElseThrow();

        assertThat(history).extracting(StoredTurn::question).containsExactly("Q1", "Q2");
        assertThat(history).extracting(StoredTurn::answer).containsExactly("A1", "A2");
        StoredTurn first = history.get(0);
        assertThat(first.sources()).containsExactly("statuts.pdf (page 3)");
        assertThat(first.excerpts()).containsExactly(new Excerpt("Le trésorier tient les comptes.", "statuts.pdf", 3));
        assertThat(first.askedAt().toInstant()).isEqualTo(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0,
                ZoneOffset.UTC).toInstant());
    }

    @Test
    void rejectsContinuationOfUnknownConversationWithoutWriting() {
        assertThatThrownBy(() -> repository.saveExchange(exchange("missing", "Q", "A"),
                PersistMode.CONTINUE_EXISTING))
                .isInstanceOf(ConversationNotFoundException.class)
                .satisfies(ex -> assertThat(((ConversationNotFoundException) ex).getConversationId())
                        .isEqualTo("missing"));

        assertThat(repository.exists("missing")).isFalse();
        assertThat(JdbcClient.create(database).sql("SELECT COUNT(*) FROM questions").query(Integer.class).single())
                .isZero();
    }

    @Test
    void historyOfUnknownConversationIsEmpty() {
        assertThat(repository.findHistory("nope")).isEmpty();
    }

    @Test
    void createsAndListsConversationsOfUser() {
        repository.createConversation("older", 7L);
        clock.advance(Duration.ofMinutes(5));
        repository.createConversation("newer", 7L);
        repository.createConversation("other-user", 8L);

        assertThat(repository.findByUser(7L)).extracting(ConversationSummary::conversationId)
                .containsExactly("newer", "older");
        assertThat(repository.findHistory("older")).hasValue(List.of());
    }

    @Test
    void updatesTitleAndCategory() {
        repository.saveExchange(exchange("conv-3", "Comment déclarer la TVA ?", "Ainsi."), PersistMode.AUTO_CREATE);

        assertThat(repository.updateMetadata("conv-3", "Déclaration de TVA", "tax")).isTrue();
        assertThat(repository.updateMetadata("unknown", "Titre", "tax")).isFalse();

        ConversationSummary summary = repository.findSummary("conv-3").orElseThrow();
        assertThat(summary.title()).isEqualTo("Déclaration de TVA");
        assertThat(summary.category()).isEqualTo("tax");
        assertThat(summary.userId()).isEqualTo(7L);
    }

    @Test
    void wrapsDatabaseFailures() {
        database.shutdown();

        assertThatThrownBy(() -> repository.saveExchange(exchange("conv-4", "Q", "A"), PersistMode.AUTO_CREATE))
                .isInstanceOf(TurnPersistenceException.class);
    }
}
