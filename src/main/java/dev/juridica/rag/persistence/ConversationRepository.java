package dev.juridica.rag.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.retrieval.Excerpt;

/**
 * Relational store of conversations, questions and responses. Sources and
 * excerpts of a response are kept as JSON text.
 */
public class ConversationRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationRepository.class);

    private static final String INSERT_CONVERSATION_SQL = """
            INSERT INTO conversations (uuid, user_id, category, title, created_at, updated_at)
            VALUES (:uuid, :userId, :category, :title, :now, :now)
            """;

    private static final String INSERT_QUESTION_SQL = """
            INSERT INTO questions (conversation_id, question_text, created_at)
            VALUES (:conversationId, :question, :now)
            """;

    private static final String INSERT_RESPONSE_SQL = """
            INSERT INTO responses (conversation_id, question_id, response_text, sources, excerpts, created_at)
            VALUES (:conversationId, :questionId, :answer, :sources, :excerpts, :now)
            """;

    private static final String HISTORY_SQL = """
            SELECT q.question_text, q.created_at AS asked_at,
                   r.response_text, r.sources, r.excerpts, r.created_at AS answered_at
            FROM questions q
            LEFT JOIN responses r ON r.question_id = q.id
            WHERE q.conversation_id = :conversationId
            ORDER BY q.created_at, q.id
            """;

    private static final String SUMMARY_COLUMNS = "uuid, user_id, title, category, created_at, updated_at";

    private static final TypeReference<List<String>> SOURCES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Excerpt>> EXCERPTS_TYPE = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConversationRepository(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores the question and its answer in one transaction.
     *
     * @throws ConversationNotFoundException when the conversation is absent in
     *         {@link PersistMode#CONTINUE_EXISTING} mode
     * @throws TurnPersistenceException on any other failure
     */
    public StoredExchange saveExchange(ExchangeRecord exchange, PersistMode mode) {
        String sources;
        String excerpts;
        try {
            sources = objectMapper.writeValueAsString(exchange.sources());
            excerpts = objectMapper.writeValueAsString(exchange.excerpts());
        } catch (JsonProcessingException ex) {
            throw new TurnPersistenceException(exchange.conversationId(), ex);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            return transactionTemplate.execute(status -> {
                long conversationRowId = findRowId(exchange.conversationId()).orElseGet(() -> {
                    if (mode == PersistMode.CONTINUE_EXISTING) {
                        throw new ConversationNotFoundException(exchange.conversationId());
                    }
                    LOGGER.debug("Creating conversation {}", exchange.conversationId());
                    return insertConversation(exchange.conversationId(), exchange.userId(), exchange.category(),
                            now);
                });
                long questionId = insert(jdbcClient.sql(INSERT_QUESTION_SQL)
                        .param("conversationId", conversationRowId)
                        .param("question", exchange.question())
                        .param("now", now));
                long responseId = insert(jdbcClient.sql(INSERT_RESPONSE_SQL)
                        .param("conversationId", conversationRowId)
                        .param("questionId", questionId)
                        .param("answer", exchange.answer())
                        .param("sources", sources)
                        .param("excerpts", excerpts)
                        .param("now", now));
                jdbcClient.sql("UPDATE conversations SET updated_at = :now WHERE id = :id")
                        .param("now", now)
                        .param("id", conversationRowId)
                        .update();
                int questions = jdbcClient.sql("SELECT COUNT(*) FROM questions WHERE conversation_id = :id")
                        .param("id", conversationRowId)
                        .query(Integer.class)
                        .single();
                return new StoredExchange(conversationRowId, questionId, responseId, questions == 1);
            });
        } catch (DataAccessException | TransactionException ex) {
            throw new TurnPersistenceException(exchange.conversationId(), ex);
        }
    }

    /**
     * Creates an empty conversation.
     */
    public ConversationSummary createConversation(String conversationId, Long userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            insertConversation(conversationId, userId, null, now);
        } catch (DataAccessException ex) {
            throw new TurnPersistenceException(conversationId, ex);
        }
        return new ConversationSummary(conversationId, userId, null, null, now, now);
    }

    public boolean exists(String conversationId) {
        return findRowId(conversationId).isPresent();
    }

    /**
     * Stored turns of the conversation, oldest first, or empty when the
     * conversation is not stored.
     */
    public Optional<List<StoredTurn>> findHistory(String conversationId) {
        Optional<Long> rowId = findRowId(conversationId);
        if (rowId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(jdbcClient.sql(HISTORY_SQL)
                .param("conversationId", rowId.get())
                .query(this::mapTurn)
                .list());
    }

    public List<ConversationSummary> findByUser(Long userId) {
        return jdbcClient.sql("SELECT " + SUMMARY_COLUMNS + " FROM conversations WHERE user_id = :userId "
                + "ORDER BY updated_at DESC, id DESC")
                .param("userId", userId)
                .query(SummaryRowMapper.INSTANCE)
                .list();
    }

    public Optional<ConversationSummary> findSummary(String conversationId) {
        return jdbcClient.sql("SELECT " + SUMMARY_COLUMNS + " FROM conversations WHERE uuid = :uuid")
                .param("uuid", conversationId)
                .query(SummaryRowMapper.INSTANCE)
                .optional();
    }

    /**
     * Sets the title and category of a conversation.
     *
     * @return whether the conversation exists
     */
    public boolean updateMetadata(String conversationId, String title, String category) {
        int updated = jdbcClient.sql("""
                UPDATE conversations SET title = :title, category = :category, updated_at = :now
                WHERE uuid = :uuid
                """)
                .param("title", title)
                .param("category", category)
                .param("now", OffsetDateTime.now(clock))
                .param("uuid", conversationId)
                .update();
        return updated > 0;
    }

    private Optional<Long> findRowId(String conversationId) {
        return jdbcClient.sql("SELECT id FROM conversations WHERE uuid = :uuid")
                .param("uuid", conversationId)
                .query(Long.class)
                .optional();
    }

    private long insertConversation(String conversationId, Long userId, String category, OffsetDateTime now) {
        return insert(jdbcClient.sql(INSERT_CONVERSATION_SQL)
                .param("uuid", conversationId)
                .param("userId", userId)
                .param("category", category)
                .param("title", null)
                .param("now", now));
    }

    private long insert(JdbcClient.StatementSpec statement) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        statement.update(keyHolder);
        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty() || !(keys.get(0).get("id") instanceof Number id)) {
            throw new IllegalStateException("Database returned no generated id");
        }
        return id.longValue();
    }

    private StoredTurn mapTurn(ResultSet rs, int rowNum) throws SQLException {
        try {
            String sources = rs.getString("sources");
            String excerpts = rs.getString("excerpts");
            return new StoredTurn(
                    rs.getString("question_text"),
                    rs.getObject("asked_at", OffsetDateTime.class),
                    rs.getString("response_text"),
                    sources == null ? List.of() : objectMapper.readValue(sources, SOURCES_TYPE),
                    excerpts == null ? List.of() : objectMapper.readValue(excerpts, EXCERPTS_TYPE),
                    rs.getObject("answered_at", OffsetDateTime.class));
        } catch (JsonProcessingException ex) {
            throw new SQLException("Corrupt response row", ex);
        }
    }

    private enum SummaryRowMapper implements RowMapper<ConversationSummary> {
        INSTANCE;

        @Override
        public ConversationSummary mapRow(ResultSet rs, int rowNum) throws SQLException {
            long userId = rs.getLong("user_id");
            return new ConversationSummary(
                    rs.getString("uuid"),
                    rs.wasNull() ? null : userId,
                    rs.getString("title"),
                    rs.getString("category"),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class));
        }
    }
}
