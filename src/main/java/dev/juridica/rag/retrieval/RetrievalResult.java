package dev.juridica.rag.retrieval;

import java.util.List;

import dev.juridica.rag.index.RetrievedDocument;

/**
 * Context assembled for one question. When {@code hasRelevant} is false no
 * citation should be shown.
 */
public record RetrievalResult(String contextText, List<String> sources, List<Excerpt> excerpts, boolean hasRelevant,
        List<RetrievedDocument> documents) {

    public RetrievalResult {
        sources = List.copyOf(sources);
        excerpts = List.copyOf(excerpts);
        documents = List.copyOf(documents);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult("", List.of(), List.of(), false, List.of());
    }
}
