package dev.juridica.rag.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import dev.juridica.rag.MutableClock;

class ConversationStateCacheTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void evictsLeastRecentlyAccessedConversation() {
        ConversationStateCache cache = new ConversationStateCache(3, Duration.ofHours(1), 5, clock);
        cache.put("c1", List.of());
        cache.put("c2", List.of());
        cache.put("c3", List.of());
        cache.get("c1");

        cache.put("c4", List.of());

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.contains("c2")).isFalse();
        assertThat(cache.contains("c1")).isTrue();
        assertThat(cache.contains("c3")).isTrue();
        assertThat(cache.contains("c4")).isTrue();
    }

    @Test
    void keepsOnlyMostRecentTurns() {
        ConversationStateCache cache = new ConversationStateCache(10, Duration.ofHours(1), 5, clock);
        IntStream.range(0, 10).forEach(i -> cache.append("c1", turn(i)));

        List<ConversationTurn> history = cache.append("c1", turn(10));

        assertThat(history).hasSize(10);
        assertThat(history.get(0).message()).isEqualTo("message 1");
        assertThat(history.get(9).message()).isEqualTo("message 10");
    }

    @Test
    void appendingAnExchangeToAFullWindowDropsTheOldestPair() {
        ConversationStateCache cache = new ConversationStateCache(10, Duration.ofHours(1), 2, clock);
        cache.append("c1", turn(0), turn(1), turn(2), turn(3));

        List<ConversationTurn> history = cache.append("c1", turn(4), turn(5));

        assertThat(history).extracting(ConversationTurn::message)
                .containsExactly("message 2", "message 3", "message 4", "message 5");
    }

    @Test
    void evictsIdleConversations() {
        ConversationStateCache cache = new ConversationStateCache(10, Duration.ofHours(1), 5, clock);
        cache.put("idle", List.of(turn(0)));
        clock.advance(Duration.ofMinutes(40));
        cache.put("active", List.of(turn(1)));
        clock.advance(Duration.ofMinutes(30));

        int evicted = cache.evictExpired();

        assertThat(evicted).isEqualTo(1);
        assertThat(cache.get("idle")).isEmpty();
        assertThat(cache.get("active")).isPresent();
    }

    @Test
    void getRefreshesLastAccess() {
        ConversationStateCache cache = new ConversationStateCache(10, Duration.ofHours(1), 5, clock);
        cache.put("c1", List.of(turn(0)));
        clock.advance(Duration.ofMinutes(50));
        cache.get("c1");
        clock.advance(Duration.ofMinutes(50));

        assertThat(cache.evictExpired()).isZero();
        assertThat(cache.contains("c1")).isTrue();
    }

    @Test
    void deleteForgetsConversation() {
        ConversationStateCache cache = new ConversationStateCache(10, Duration.ofHours(1), 5, clock);
        cache.put("c1", List.of(turn(0)));

        assertThat(cache.delete("c1")).isTrue();
        assertThat(cache.delete("c1")).isFalse();
        assertThat(cache.get("c1")).isEmpty();
    }

    private ConversationTurn turn(int index) {
        Instant now = clock.instant();
        return index % 2 == 0
                ? ConversationTurn.user("message " + index, now)
                : ConversationTurn.assistant("message " + index, now);
    }
}
