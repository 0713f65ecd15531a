package dev.juridica.rag.retrieval;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the retrieval pipeline.
 */
@ConfigurationProperties(prefix = "rag.retrieval")
public class RetrievalProperties {

    /**
     * Number of documents requested from the vector backends.
     */
    private int topK = 3;

    /**
     * Minimum normalized score a vector result needs to be used as context.
     */
    private double highConfidenceThreshold = 0.5d;

    /**
     * Greetings shorter than this are answered without retrieved context.
     */
    private int trivialQueryMaxLength = 20;

    private int maxExcerptLength = 500;

    /**
     * How long vector search results are cached.
     */
    private Duration cacheTtl = Duration.ofMinutes(30);

    /**
     * Whether cached search results are also written to disk.
     */
    private boolean persistCachedResults;

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public void setHighConfidenceThreshold(double highConfidenceThreshold) {
        this.highConfidenceThreshold = highConfidenceThreshold;
    }

    public int getTrivialQueryMaxLength() {
        return trivialQueryMaxLength;
    }

    public void setTrivialQueryMaxLength(int trivialQueryMaxLength) {
        this.trivialQueryMaxLength = trivialQueryMaxLength;
    }

    public int getMaxExcerptLength() {
        return maxExcerptLength;
    }

    public void setMaxExcerptLength(int maxExcerptLength) {
        this.maxExcerptLength = maxExcerptLength;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public boolean isPersistCachedResults() {
        return persistCachedResults;
    }

    public void setPersistCachedResults(boolean persistCachedResults) {
        this.persistCachedResults = persistCachedResults;
    }
}
