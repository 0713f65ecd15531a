package dev.juridica.rag.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import dev.juridica.rag.retrieval.Excerpt;

/**
 * A stored question with its answer, if any.
 */
public record StoredTurn(String question, OffsetDateTime askedAt, String answer, List<String> sources,
        List<Excerpt> excerpts, OffsetDateTime answeredAt) {
}
