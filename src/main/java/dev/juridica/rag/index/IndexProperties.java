package dev.juridica.rag.index;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the two vector backends.
 */
@ConfigurationProperties(prefix = "rag.index")
public class IndexProperties {

    /**
     * Directory holding the persisted flat index.
     */
    private String flatDirectory = "data/flat-index";

    /**
     * Number of chunks embedded per request while building the flat index.
     */
    private int batchSize = 32;

    /**
     * Pause between two embedding batches.
     */
    private Duration batchPause = Duration.ofMillis(200);

    /**
     * Maximum squared L2 distance accepted by the flat index.
     */
    private double flatThreshold = 1.0d;

    /**
     * Name of the persistent collection.
     */
    private String collectionName = "documents";

    /**
     * Minimum cosine similarity accepted by the persistent collection.
     */
    private double collectionThreshold = 0.35d;

    public String getFlatDirectory() {
        return flatDirectory;
    }

    public void setFlatDirectory(String flatDirectory) {
        this.flatDirectory = flatDirectory;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getBatchPause() {
        return batchPause;
    }

    public void setBatchPause(Duration batchPause) {
        this.batchPause = batchPause;
    }

    public double getFlatThreshold() {
        return flatThreshold;
    }

    public void setFlatThreshold(double flatThreshold) {
        this.flatThreshold = flatThreshold;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public void setCollectionName(String collectionName) {
        this.collectionName = collectionName;
    }

    public double getCollectionThreshold() {
        return collectionThreshold;
    }

    public void setCollectionThreshold(double collectionThreshold) {
        this.collectionThreshold = collectionThreshold;
    }
}
