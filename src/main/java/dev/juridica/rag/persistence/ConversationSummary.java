package dev.juridica.rag.persistence;

import java.time.OffsetDateTime;

/**
 * Conversation row as listed for a user.
 */
public record ConversationSummary(String conversationId, Long userId, String title, String category,
        OffsetDateTime createdAt, OffsetDateTime updatedAt) {
}
