package dev.juridica.rag.conversation;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Conversation state and prompt settings.
 */
@ConfigurationProperties(prefix = "rag.conversation")
public class ConversationProperties {

    /**
     * Maximum number of conversations held in memory.
     */
    private int cacheCapacity = 1000;

    /**
     * Idle time after which a conversation leaves the cache.
     */
    private Duration ttl = Duration.ofHours(1);

    /**
     * Exchanges kept per conversation; the cache holds twice as many turns.
     */
    private int maxHistoryMessages = 5;

    /**
     * Number of most recent turns sent to the model.
     */
    private int promptHistoryTurns = 6;

    /**
     * Answer returned when the model cannot be reached.
     */
    private String apologyMessage = "Je suis désolé, je ne peux pas répondre à votre question pour le moment. "
            + "Veuillez réessayer plus tard.";

    /**
     * Threads of the executor running asynchronous side effects.
     */
    private int executorThreads = 4;

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public void setCacheCapacity(int cacheCapacity) {
        this.cacheCapacity = cacheCapacity;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public int getMaxHistoryMessages() {
        return maxHistoryMessages;
    }

    public void setMaxHistoryMessages(int maxHistoryMessages) {
        this.maxHistoryMessages = maxHistoryMessages;
    }

    public int getPromptHistoryTurns() {
        return promptHistoryTurns;
    }

    public void setPromptHistoryTurns(int promptHistoryTurns) {
        this.promptHistoryTurns = promptHistoryTurns;
    }

    public String getApologyMessage() {
        return apologyMessage;
    }

    public void setApologyMessage(String apologyMessage) {
        this.apologyMessage = apologyMessage;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }
}
