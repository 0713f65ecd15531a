package dev.juridica.rag.completion;

import java.util.List;

/**
 * Deterministic {@link CompletionClient} used in tests and local development
 * where the OpenAI API should not be contacted.
 */
public class MockCompletionClient implements CompletionClient {

    private static final String PREFIX = "[mocked answer] ";

    @Override
    public String complete(List<ChatMessage> messages) {
        String question = "";
        for (int i = messages.size() - 1; i >= 0; i--) {
            if ("user".equals(messages.get(i).role())) {
                question = messages.get(i).content();
                break;
            }
        }
        return PREFIX + "This is a mocked response. Provide an API key to reach the real OpenAI service. "
                + "Messages received: " + messages.size() + ". Last user message: " + question;
    }
}
