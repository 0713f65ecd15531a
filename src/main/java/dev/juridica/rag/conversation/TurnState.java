package dev.juridica.rag.conversation;

/**
 * Steps of one conversation turn, in order.
 */
enum TurnState {
    RECEIVE_QUERY,
    CLASSIFY,
    RETRIEVE,
    GENERATE,
    PERSIST,
    DETECT_DOCUMENT_REQUEST,
    RESPOND
}
