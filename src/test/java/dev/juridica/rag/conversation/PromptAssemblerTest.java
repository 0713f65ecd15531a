package dev.juridica.rag.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.juridica.rag.cache.ConversationTurn;
import dev.juridica.rag.completion.ChatMessage;
import dev.juridica.rag.retrieval.Excerpt;
import dev.juridica.rag.retrieval.RetrievalResult;

class PromptAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static List<ConversationTurn> history(int exchanges) {
        List<ConversationTurn> turns = new ArrayList<>();
        for (int i = 0; i < exchanges; i++) {
            turns.add(ConversationTurn.user("question " + i, NOW));
            turns.add(ConversationTurn.assistant("réponse " + i, NOW));
        }
        return turns;
    }

    @Test
    void keepsOnlyMostRecentTurns() {
        List<ChatMessage> messages = new PromptAssembler(6).assemble("question 4", history(4),
                RetrievalResult.empty());

        assertThat(messages).hasSize(8);
        assertThat(messages.get(0)).isEqualTo(ChatMessage.system(PromptAssembler.SYSTEM_INSTRUCTION));
        assertThat(messages.get(1)).isEqualTo(ChatMessage.user("question 1"));
        assertThat(messages.get(6)).isEqualTo(ChatMessage.assistant("réponse 3"));
    }

    @Test
    void addsContextBeforeQuestion() {
        RetrievalResult retrieval = new RetrievalResult("Relevant context:\n1. Texte (Source: statuts.pdf)\n",
                List.of("statuts.pdf"), List.of(new Excerpt("Texte", "statuts.pdf", null)), true, List.of());

        List<ChatMessage> messages = new PromptAssembler(6).assemble("Qui signe ?", List.of(), retrieval);

        assertThat(messages).hasSize(2);
        assertThat(messages.get(1).content())
                .isEqualTo("Relevant context:\n1. Texte (Source: statuts.pdf)\n\nQuestion : Qui signe ?");
    }

    @Test
    void warnsModelWhenNothingRelevantWasFound() {
        List<ChatMessage> messages = new PromptAssembler(0).assemble("Qui signe ?", history(2),
                RetrievalResult.empty());

        assertThat(messages).hasSize(2);
        assertThat(messages.get(1).role()).isEqualTo("user");
        assertThat(messages.get(1).content()).startsWith(PromptAssembler.NO_CONTEXT_NOTICE)
                .endsWith("Question : Qui signe ?");
    }
}
