package dev.juridica.rag.conversation;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import dev.juridica.rag.retrieval.Excerpt;

/**
 * One message of a conversation history as returned to clients.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(String role, String content, Instant timestamp, List<String> sources,
        List<Excerpt> excerpts) {
}
