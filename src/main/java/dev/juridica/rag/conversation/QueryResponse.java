package dev.juridica.rag.conversation;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import dev.juridica.rag.document.GeneratedDocument;
import dev.juridica.rag.retrieval.Excerpt;

/**
 * Answer to a {@link QueryRequest}.
 */
public record QueryResponse(String answer, List<String> sources, List<Excerpt> excerpts, String conversationId,
        @JsonInclude(JsonInclude.Include.NON_NULL) GeneratedDocument generatedDocument) {
}
