package dev.juridica.rag.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-memory history of active conversations. The least recently
 * accessed conversation is evicted when the capacity is exceeded, and
 * {@link #evictExpired()} drops conversations idle for longer than the TTL.
 * Each history keeps at most {@code 2 * maxHistoryMessages} turns.
 */
public class ConversationStateCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationStateCache.class);

    private final LruMap<String, ConversationRecord> conversations;
    private final Duration ttl;
    private final int maxTurns;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public ConversationStateCache(int capacity, Duration ttl, int maxHistoryMessages, Clock clock) {
        if (maxHistoryMessages <= 0) {
            throw new IllegalArgumentException("maxHistoryMessages must be positive");
        }
        this.conversations = new LruMap<>(capacity);
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.maxTurns = maxHistoryMessages * 2;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached history and marks the conversation as recently used.
     */
    public Optional<List<ConversationTurn>> get(String conversationId) {
        lock.lock();
        try {
            ConversationRecord record = conversations.get(conversationId);
            if (record == null) {
                return Optional.empty();
            }
            conversations.put(conversationId, record.accessedAt(clock.instant()));
            return Optional.of(record.turns());
        } finally {
            lock.unlock();
        }
    }

    public void put(String conversationId, List<ConversationTurn> history) {
        Objects.requireNonNull(conversationId, "conversationId");
        lock.lock();
        try {
            store(new ConversationRecord(conversationId, trim(history), clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends turns to the history, creating it when absent, and trims the
     * result to the most recent turns.
     *
     * @return the history after the append
     */
    public List<ConversationTurn> append(String conversationId, ConversationTurn... turns) {
        Objects.requireNonNull(conversationId, "conversationId");
        lock.lock();
        try {
            ConversationRecord existing = conversations.peek(conversationId);
            List<ConversationTurn> history = new ArrayList<>(existing != null ? existing.turns() : List.of());
            history.addAll(Arrays.asList(turns));
            ConversationRecord record = new ConversationRecord(conversationId, trim(history), clock.instant());
            store(record);
            return record.turns();
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String conversationId) {
        lock.lock();
        try {
            return conversations.remove(conversationId) != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String conversationId) {
        lock.lock();
        try {
            return conversations.containsKey(conversationId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts every conversation whose last access is older than the TTL.
     *
     * @return the number of evicted conversations
     */
    public int evictExpired() {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(ttl);
            List<String> expired = conversations.removeIf((id, record) -> record.lastAccess().isBefore(cutoff));
            if (!expired.isEmpty()) {
                LOGGER.debug("Evicted {} idle conversations", expired.size());
            }
            return expired.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return conversations.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxTurns() {
        return maxTurns;
    }

    private void store(ConversationRecord record) {
        conversations.put(record.conversationId(), record)
                .ifPresent(evicted -> LOGGER.debug("Conversation {} evicted from cache", evicted.getKey()));
    }

    private List<ConversationTurn> trim(List<ConversationTurn> history) {
        if (history.size() <= maxTurns) {
            return List.copyOf(history);
        }
        return List.copyOf(history.subList(history.size() - maxTurns, history.size()));
    }

    record ConversationRecord(String conversationId, List<ConversationTurn> turns, Instant lastAccess) {

        ConversationRecord accessedAt(Instant instant) {
            return new ConversationRecord(conversationId, turns, instant);
        }
    }
}
