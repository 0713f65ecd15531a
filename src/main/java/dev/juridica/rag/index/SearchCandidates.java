package dev.juridica.rag.index;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared post-processing of ranked candidates: oversampling, threshold and
 * deduplication by source and page.
 */
final class SearchCandidates {

    static final int OVERSAMPLING = 3;

    private SearchCandidates() {
    }

    static List<RetrievedDocument> select(List<RetrievedDocument> rankedBestFirst, int k, double threshold,
            ScoreComparator comparator) {
        if (k <= 0) {
            return List.of();
        }
        int window = Math.min(rankedBestFirst.size(), k * OVERSAMPLING);
        Set<String> seen = new HashSet<>();
        List<RetrievedDocument> selected = new ArrayList<>(k);
        for (RetrievedDocument candidate : rankedBestFirst.subList(0, window)) {
            if (!comparator.accepts(candidate.rawScore(), threshold)) {
                continue;
            }
            if (!seen.add(candidate.source() + "|" + candidate.page())) {
                continue;
            }
            selected.add(candidate);
            if (selected.size() == k) {
                break;
            }
        }
        return selected;
    }
}
