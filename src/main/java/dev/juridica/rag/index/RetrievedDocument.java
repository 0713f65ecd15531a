package dev.juridica.rag.index;

import java.util.Objects;

import dev.juridica.rag.chunking.Chunk;

/**
 * A chunk returned by retrieval. {@code score} is a similarity normalized to
 * [0, 1] whatever the backend; {@code rawScore} keeps the backend's own number.
 */
public record RetrievedDocument(Chunk chunk, double score, double rawScore, Origin origin) {

    public RetrievedDocument {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(origin, "origin");
        if (score < 0.0d || score > 1.0d) {
            throw new IllegalArgumentException("score must be within [0, 1] but was " + score);
        }
    }

    public static RetrievedDocument provided(Chunk chunk) {
        return new RetrievedDocument(chunk, 1.0d, 1.0d, Origin.PROVIDED);
    }

    public String content() {
        return chunk.content();
    }

    public String source() {
        return chunk.source();
    }

    public Integer page() {
        return chunk.page();
    }

    static double clamp(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}
