package dev.juridica.rag.chunking;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the chunks produced during ingestion. Sizes are expressed in
 * tokens and converted to characters with {@link #getCharsPerToken()}.
 */
@ConfigurationProperties(prefix = "rag.chunking")
public class ChunkingProperties {

    /**
     * Target chunk size in tokens.
     */
    private int chunkSize = 300;

    /**
     * Overlap between consecutive chunks in tokens.
     */
    private int chunkOverlap = 50;

    /**
     * Approximation used to convert tokens into characters.
     */
    private int charsPerToken = 4;

    /**
     * Chunks shorter than this many characters are merged with their successor.
     */
    private int minChunkSize = 100;

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getCharsPerToken() {
        return charsPerToken;
    }

    public void setCharsPerToken(int charsPerToken) {
        this.charsPerToken = charsPerToken;
    }

    public int getMinChunkSize() {
        return minChunkSize;
    }

    public void setMinChunkSize(int minChunkSize) {
        this.minChunkSize = minChunkSize;
    }
}
