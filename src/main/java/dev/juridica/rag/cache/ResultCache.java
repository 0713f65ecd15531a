package dev.juridica.rag.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Two-tier cache for expensive results such as vector searches. The memory
 * tier is a bounded LRU map; entries can optionally be written to disk as one
 * JSON file per key, which survives restarts. Expired entries are dropped
 * lazily on read and by a background sweep of the memory tier.
 * <p>
 * A miss never throws. Disk failures are logged and treated like a miss.
 */
public class ResultCache implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultCache.class);

    private final LruMap<String, CacheEntry<Object>> memory;
    private final DiskCacheStore disk;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration defaultTtl;
    private final ReentrantLock lock = new ReentrantLock();
    private final ScheduledExecutorService sweeper;

    private long memoryHits;
    private long diskHits;
    private long misses;
    private long memoryStores;
    private long diskStores;

    public ResultCache(CacheProperties properties, ObjectMapper objectMapper, Clock clock) {
        Objects.requireNonNull(properties, "properties");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.memory = new LruMap<>(properties.getMemorySize());
        this.defaultTtl = properties.getDefaultTtl();
        Path directory = Path.of(properties.getDiskDir());
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            LOGGER.warn("Unable to create cache directory {}: {}", directory, ex.getMessage());
        }
        this.disk = new DiskCacheStore(directory, objectMapper);
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "result-cache-sweeper");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            return thread;
        });
        long interval = properties.getSweepInterval().toMillis();
        sweeper.scheduleWithFixedDelay(this::sweepQuietly, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("Result cache ready (memory size {}, disk directory {})", properties.getMemorySize(), directory);
    }

    /**
     * Looks the key up in memory, then on disk.
     *
     * @param key  cache key
     * @param type expected value type, used to rebuild values read from disk
     * @return the cached value, or empty on a miss
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry<Object> entry = memory.get(key);
            if (entry != null) {
                if (!entry.isExpired(now)) {
                    memoryHits++;
                    return Optional.of(convert(entry.value(), type));
                }
                memory.remove(key);
            }
            Optional<T> fromDisk = readDisk(key, type, now);
            if (fromDisk.isPresent()) {
                diskHits++;
                return fromDisk;
            }
            misses++;
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtl, false);
    }

    /**
     * Stores the value in memory and, when {@code persist} is set, on disk.
     */
    public void set(String key, Object value, Duration ttl, boolean persist) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        lock.lock();
        try {
            Instant now = clock.instant();
            memory.put(key, new CacheEntry<>(value, now, ttl))
                    .ifPresent(evicted -> LOGGER.debug("Evicted cache entry {}", evicted.getKey()));
            memoryStores++;
            if (persist) {
                writeDisk(key, value, now, ttl);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            boolean removed = memory.remove(key) != null;
            try {
                removed |= disk.delete(key);
            } catch (IOException ex) {
                LOGGER.warn("Unable to delete disk cache entry {}: {}", key, ex.getMessage());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            memory.clear();
            try {
                disk.clear();
            } catch (IOException ex) {
                LOGGER.warn("Unable to clear disk cache: {}", ex.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(memoryHits, diskHits, misses, memoryStores, diskStores, memory.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops expired memory entries.
     *
     * @return the number of removed entries
     */
    public int sweepExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> removed = memory.removeIf((key, entry) -> entry.isExpired(now));
            if (!removed.isEmpty()) {
                LOGGER.debug("Swept {} expired cache entries", removed.size());
            }
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
    }

    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException ex) {
            LOGGER.warn("Cache sweep failed: {}", ex.getMessage(), ex);
        }
    }

    private <T> Optional<T> readDisk(String key, Class<T> type, Instant now) {
        try {
            Optional<DiskCacheStore.StoredEntry> stored = disk.read(key);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            DiskCacheStore.StoredEntry body = stored.get();
            Instant createdAt = Instant.ofEpochMilli(body.timestamp());
            Duration ttl = Duration.ofMillis(body.ttl());
            if (new CacheEntry<>(body.value(), createdAt, ttl).isExpired(now)) {
                disk.delete(key);
                return Optional.empty();
            }
            T value = objectMapper.treeToValue(body.value(), type);
            memory.put(key, new CacheEntry<>(value, createdAt, ttl));
            return Optional.of(value);
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.warn("Unable to read disk cache entry {}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private void writeDisk(String key, Object value, Instant now, Duration ttl) {
        try {
            JsonNode node = objectMapper.valueToTree(value);
            disk.write(key, new DiskCacheStore.StoredEntry(node, now.toEpochMilli(), ttl.toMillis()));
            diskStores++;
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.warn("Unable to write disk cache entry {}: {}", key, ex.getMessage());
        }
    }

    private <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        return objectMapper.convertValue(value, type);
    }

    Path diskFile(String key) {
        return disk.fileFor(key);
    }
}
