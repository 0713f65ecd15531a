package dev.juridica.rag.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for chunks and questions.
 * Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     */
    float[] embed(String text);

    /**
     * Create embeddings for a batch of texts, in input order.
     *
     * @param texts the texts to embed
     * @return one vector per text
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * @return the dimension of every vector produced by this provider
     */
    int dimensions();
}
