package dev.juridica.rag.completion;

import java.util.List;

/**
 * Abstraction over the language model producing answers.
 */
public interface CompletionClient {

    /**
     * Produce the assistant reply to the conversation.
     *
     * @param messages system instruction, history and the current question
     * @return the generated text
     * @throws dev.juridica.rag.ExternalServiceUnavailableException when the model cannot be reached
     */
    String complete(List<ChatMessage> messages);
}
