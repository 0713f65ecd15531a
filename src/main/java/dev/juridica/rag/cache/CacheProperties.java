package dev.juridica.rag.cache;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the two-tier {@link ResultCache}.
 */
@ConfigurationProperties(prefix = "rag.cache")
public class CacheProperties {

    /**
     * Maximum number of entries kept in memory.
     */
    private int memorySize = 1000;

    /**
     * Directory holding one JSON file per persisted entry.
     */
    private String diskDir = "data/cache";

    /**
     * Time to live used when a caller does not pass one.
     */
    private Duration defaultTtl = Duration.ofHours(1);

    /**
     * Interval of the background purge of expired memory entries.
     */
    private Duration sweepInterval = Duration.ofSeconds(60);

    public int getMemorySize() {
        return memorySize;
    }

    public void setMemorySize(int memorySize) {
        this.memorySize = memorySize;
    }

    public String getDiskDir() {
        return diskDir;
    }

    public void setDiskDir(String diskDir) {
        this.diskDir = diskDir;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
