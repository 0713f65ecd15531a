package dev.juridica.rag.retrieval;

/**
 * Excerpt cited with an answer.
 */
public record Excerpt(String content, String source, Integer page) {
}
