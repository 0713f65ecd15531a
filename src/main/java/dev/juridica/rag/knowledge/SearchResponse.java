package dev.juridica.rag.knowledge;

import java.util.List;

import dev.juridica.rag.index.RetrievedDocument;

public record SearchResponse(List<Hit> results, int totalCount) {

    static SearchResponse of(List<RetrievedDocument> documents) {
        List<Hit> hits = documents.stream()
                .map(document -> new Hit(document.content(), document.source(), document.page(), document.score(),
                        document.origin().name()))
                .toList();
        return new SearchResponse(hits, hits.size());
    }

    /**
     * One matching chunk with its normalized score.
     */
    public record Hit(String content, String source, Integer page, double score, String origin) {
    }
}
