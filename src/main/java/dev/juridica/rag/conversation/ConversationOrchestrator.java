package dev.juridica.rag.conversation;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import dev.juridica.rag.cache.ConversationStateCache;
import dev.juridica.rag.cache.ConversationTurn;
import dev.juridica.rag.completion.CompletionClient;
import dev.juridica.rag.document.AnswerDocumentService;
import dev.juridica.rag.document.GeneratedDocument;
import dev.juridica.rag.persistence.ConversationNotFoundException;
import dev.juridica.rag.persistence.ConversationRepository;
import dev.juridica.rag.persistence.ConversationSummary;
import dev.juridica.rag.persistence.ExchangeRecord;
import dev.juridica.rag.persistence.PersistMode;
import dev.juridica.rag.persistence.StoredExchange;
import dev.juridica.rag.persistence.StoredTurn;
import dev.juridica.rag.persistence.TurnPersistenceException;
import dev.juridica.rag.retrieval.Excerpt;
import dev.juridica.rag.retrieval.RetrievalOrchestrator;
import dev.juridica.rag.retrieval.RetrievalResult;

/**
 * Coordinates one conversation turn: retrieval of context, answer generation,
 * persistence of the exchange and the optional answer document. Retrieval and
 * generation failures degrade the answer instead of failing the turn;
 * persistence failures are reported to the caller.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final RetrievalOrchestrator retrievalOrchestrator;
    private final CompletionClient completionClient;
    private final ConversationRepository repository;
    private final ConversationStateCache stateCache;
    private final QueryClassifier classifier;
    private final PromptAssembler promptAssembler;
    private final ConversationMetadataGenerator metadataGenerator;
    private final AnswerDocumentService documentService;
    private final Executor chatExecutor;
    private final ConversationProperties properties;
    private final Clock clock;

    public ConversationOrchestrator(RetrievalOrchestrator retrievalOrchestrator, CompletionClient completionClient,
            ConversationRepository repository, ConversationStateCache stateCache, QueryClassifier classifier,
            ConversationMetadataGenerator metadataGenerator, AnswerDocumentService documentService,
            Executor chatExecutor, ConversationProperties properties, Clock clock) {
        this.retrievalOrchestrator = Objects.requireNonNull(retrievalOrchestrator, "retrievalOrchestrator");
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.stateCache = Objects.requireNonNull(stateCache, "stateCache");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.metadataGenerator = Objects.requireNonNull(metadataGenerator, "metadataGenerator");
        this.documentService = Objects.requireNonNull(documentService, "documentService");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.promptAssembler = new PromptAssembler(properties.getPromptHistoryTurns());
    }

    /**
     * Answers the question and records the exchange.
     *
     * @throws ConversationNotFoundException when continuing a conversation that
     *         is not stored
     * @throws TurnPersistenceException when the exchange could not be stored
     */
    public QueryResponse processQuery(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        transition(TurnState.RECEIVE_QUERY, request.conversationId());
        stateCache.evictExpired();
        boolean newConversation = !StringUtils.hasText(request.conversationId());
        String conversationId = newConversation ? UUID.randomUUID().toString() : request.conversationId();
        PersistMode mode = newConversation ? PersistMode.AUTO_CREATE : request.mode();
        if (mode == PersistMode.CONTINUE_EXISTING) {
            requireStored(conversationId);
        }
        List<ConversationTurn> history = stateCache.get(conversationId).orElse(List.of());

        transition(TurnState.CLASSIFY, conversationId);
        String category = classifier.classify(request.query());

        transition(TurnState.RETRIEVE, conversationId);
        RetrievalResult retrieval = retrieve(request, conversationId);

        transition(TurnState.GENERATE, conversationId);
        String answer = generate(request.query(), history, retrieval, conversationId);
        Instant now = clock.instant();
        stateCache.append(conversationId, ConversationTurn.user(request.query(), now),
                ConversationTurn.assistant(answer, now));

        List<String> sources = retrieval.hasRelevant() ? retrieval.sources() : List.of();
        List<Excerpt> excerpts = retrieval.hasRelevant() ? retrieval.excerpts() : List.of();

        transition(TurnState.PERSIST, conversationId);
        StoredExchange stored;
        try {
            stored = repository.saveExchange(new ExchangeRecord(conversationId, request.userId(), request.query(),
                    answer, sources, excerpts, category), mode);
        } catch (ConversationNotFoundException ex) {
            stateCache.delete(conversationId);
            LOGGER.warn("Conversation {} disappeared before its turn was stored", conversationId);
            throw ex;
        } catch (TurnPersistenceException ex) {
            LOGGER.warn("Turn of conversation {} was not stored, the cached history still contains it: {}",
                    conversationId, ex.getMessage());
            throw ex;
        }

        transition(TurnState.DETECT_DOCUMENT_REQUEST, conversationId);
        GeneratedDocument document = documentService
                .generateIfRequested(request.query(), answer, sources, conversationId)
                .orElse(null);

        if (stored.firstExchange()) {
            try {
                chatExecutor.execute(() -> enrich(conversationId, request.query(), answer));
            } catch (RejectedExecutionException ex) {
                LOGGER.warn("Metadata of conversation {} not scheduled: {}", conversationId, ex.getMessage());
            }
        }

        transition(TurnState.RESPOND, conversationId);
        return new QueryResponse(answer, sources, excerpts, conversationId, document);
    }

    /**
     * History of a conversation: stored rows when the conversation is
     * persisted, otherwise the cached turns.
     */
    public List<HistoryEntry> getHistory(String conversationId) {
        Optional<List<StoredTurn>> stored = repository.findHistory(conversationId);
        if (stored.isPresent()) {
            List<HistoryEntry> entries = new ArrayList<>();
            for (StoredTurn turn : stored.get()) {
                entries.add(new HistoryEntry("user", turn.question(), turn.askedAt().toInstant(), null, null));
                if (turn.answer() != null) {
                    entries.add(new HistoryEntry("assistant", turn.answer(),
                            turn.answeredAt() != null ? turn.answeredAt().toInstant() : null, turn.sources(),
                            turn.excerpts()));
                }
            }
            return entries;
        }
        return stateCache.get(conversationId)
                .map(turns -> turns.stream()
                        .map(turn -> new HistoryEntry(turn.role().value(), turn.message(), turn.timestamp(), null,
                                null))
                        .toList())
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    }

    /**
     * Forgets the cached state of a conversation. Stored rows are kept.
     */
    public boolean clear(String conversationId) {
        boolean removed = stateCache.delete(conversationId);
        LOGGER.debug("Cleared cached conversation {}: {}", conversationId, removed);
        return removed;
    }

    public ConversationSummary createConversation(Long userId) {
        String conversationId = UUID.randomUUID().toString();
        ConversationSummary summary = repository.createConversation(conversationId, userId);
        stateCache.put(conversationId, List.of());
        LOGGER.info("Created conversation {} for user {}", conversationId, userId);
        return summary;
    }

    public List<ConversationSummary> listConversations(Long userId) {
        return repository.findByUser(userId);
    }

    private void requireStored(String conversationId) {
        boolean stored;
        try {
            stored = repository.exists(conversationId);
        } catch (DataAccessException ex) {
            throw new TurnPersistenceException(conversationId, ex);
        }
        if (!stored) {
            LOGGER.debug("Rejecting continuation of unknown conversation {}", conversationId);
            throw new ConversationNotFoundException(conversationId);
        }
    }

    private RetrievalResult retrieve(QueryRequest request, String conversationId) {
        try {
            return retrievalOrchestrator.retrieve(request.query(), request.contextDocuments(), conversationId);
        } catch (RuntimeException ex) {
            LOGGER.warn("Retrieval failed for conversation {}, answering without context: {}", conversationId,
                    ex.getMessage(), ex);
            return RetrievalResult.empty();
        }
    }

    private String generate(String query, List<ConversationTurn> history, RetrievalResult retrieval,
            String conversationId) {
        try {
            String answer = completionClient.complete(promptAssembler.assemble(query, history, retrieval));
            if (!StringUtils.hasText(answer)) {
                LOGGER.error("Empty completion for conversation {}", conversationId);
                return properties.getApologyMessage();
            }
            return answer.strip();
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to produce response for conversation {}: {}", conversationId, ex.getMessage(), ex);
            return properties.getApologyMessage();
        }
    }

    private void enrich(String conversationId, String question, String answer) {
        try {
            ConversationMetadataGenerator.ConversationMetadata metadata = metadataGenerator.generate(question, answer);
            repository.updateMetadata(conversationId, metadata.title(), metadata.category());
            LOGGER.debug("Conversation {} titled '{}' ({})", conversationId, metadata.title(), metadata.category());
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to store metadata of conversation {}: {}", conversationId, ex.getMessage(), ex);
        }
    }

    private void transition(TurnState state, String conversationId) {
        LOGGER.debug("Conversation {} -> {}", conversationId, state);
    }
}
