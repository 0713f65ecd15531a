package dev.juridica.rag.conversation;

import java.util.List;
import java.util.Objects;

import dev.juridica.rag.persistence.PersistMode;
import dev.juridica.rag.retrieval.ContextDocument;

/**
 * One question to answer. Without conversation id a new conversation is
 * started.
 */
public record QueryRequest(String query, String conversationId, Long userId, List<ContextDocument> contextDocuments,
        PersistMode mode) {

    public QueryRequest {
        Objects.requireNonNull(query, "query");
        contextDocuments = contextDocuments == null ? List.of() : List.copyOf(contextDocuments);
        mode = mode == null ? PersistMode.AUTO_CREATE : mode;
    }

    public static QueryRequest of(String query) {
        return new QueryRequest(query, null, null, List.of(), PersistMode.AUTO_CREATE);
    }
}
