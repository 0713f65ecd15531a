package dev.juridica.rag.persistence;

/**
 * Identifiers assigned to a stored exchange. {@code firstExchange} is set when
 * it is the first question of its conversation.
 */
public record StoredExchange(long conversationRowId, long questionId, long responseId, boolean firstExchange) {
}
