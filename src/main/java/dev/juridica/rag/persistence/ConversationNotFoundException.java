package dev.juridica.rag.persistence;

/**
 * The conversation is neither stored nor cached.
 */
public class ConversationNotFoundException extends RuntimeException {

    private final String conversationId;

    public ConversationNotFoundException(String conversationId) {
        super("Conversation " + conversationId + " not found");
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
