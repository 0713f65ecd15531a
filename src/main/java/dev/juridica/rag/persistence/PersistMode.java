package dev.juridica.rag.persistence;

/**
 * What to do when an exchange targets a conversation that is not stored yet.
 */
public enum PersistMode {
    /** Create the conversation row. */
    AUTO_CREATE,
    /** Fail with {@link ConversationNotFoundException}. */
    CONTINUE_EXISTING
}
