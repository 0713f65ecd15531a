package dev.juridica.rag.persistence;

import java.util.List;
import java.util.Objects;

import dev.juridica.rag.retrieval.Excerpt;

/**
 * A question and its answer, ready to be stored.
 */
public record ExchangeRecord(String conversationId, Long userId, String question, String answer,
        List<String> sources, List<Excerpt> excerpts, String category) {

    public ExchangeRecord {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(answer, "answer");
        sources = sources == null ? List.of() : List.copyOf(sources);
        excerpts = excerpts == null ? List.of() : List.copyOf(excerpts);
    }
}
