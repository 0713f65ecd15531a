package dev.juridica.rag.cache;

/**
 * Snapshot of the {@link ResultCache} counters.
 */
public record CacheStats(long memoryHits, long diskHits, long misses, long memoryStores, long diskStores,
        int memorySize) {

    public long totalRequests() {
        return memoryHits + diskHits + misses;
    }

    public double hitRate() {
        long total = totalRequests();
        return total == 0 ? 0.0d : (double) (memoryHits + diskHits) / total;
    }
}
