package dev.juridica.rag.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached value with its creation time and time to live.
 */
public record CacheEntry<T>(T value, Instant createdAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
