package dev.juridica.rag.conversation;

import java.util.ArrayList;
import java.util.List;

import dev.juridica.rag.cache.ConversationTurn;
import dev.juridica.rag.completion.ChatMessage;
import dev.juridica.rag.retrieval.RetrievalResult;

/**
 * Builds the messages sent to the model: the system instruction, the most
 * recent turns and the question with its context.
 */
public class PromptAssembler {

    static final String SYSTEM_INSTRUCTION = """
            Tu es un assistant juridique spécialisé dans le droit applicable aux Junior-Entreprises. \
            Réponds en français, de façon précise et structurée. Appuie-toi sur le contexte fourni et cite \
            les sources entre parenthèses lorsque tu les utilises. Si l'information ne figure pas dans le \
            contexte, dis-le clairement.""";

    static final String NO_CONTEXT_NOTICE = """
            Aucun document pertinent n'a été trouvé pour cette question. Réponds à partir de tes connaissances \
            générales, signale-le, et n'invente aucune source ni citation.""";

    private final int historyTurns;

    public PromptAssembler(int historyTurns) {
        if (historyTurns < 0) {
            throw new IllegalArgumentException("historyTurns must not be negative");
        }
        this.historyTurns = historyTurns;
    }

    public List<ChatMessage> assemble(String query, List<ConversationTurn> history, RetrievalResult retrieval) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(SYSTEM_INSTRUCTION));
        int from = Math.max(0, history.size() - historyTurns);
        for (ConversationTurn turn : history.subList(from, history.size())) {
            messages.add(turn.role() == ConversationTurn.Role.USER
                    ? ChatMessage.user(turn.message())
                    : ChatMessage.assistant(turn.message()));
        }
        if (retrieval.hasRelevant()) {
            messages.add(ChatMessage.user(retrieval.contextText() + "\nQuestion : " + query));
        } else {
            messages.add(ChatMessage.user(NO_CONTEXT_NOTICE + "\n\nQuestion : " + query));
        }
        return messages;
    }
}
