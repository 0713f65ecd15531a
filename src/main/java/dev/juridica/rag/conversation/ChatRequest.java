package dev.juridica.rag.conversation;

import java.util.List;

import dev.juridica.rag.retrieval.ContextDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests.
 */
public record ChatRequest(
        @NotBlank String query,
        String conversationId,
        Long userId,
        @Valid List<ContextDocument> contextDocuments) {
}
