package dev.juridica.rag.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.juridica.rag.cache.ResultCache;
import dev.juridica.rag.index.Origin;
import dev.juridica.rag.index.RetrievedDocument;
import dev.juridica.rag.index.VectorIndex;

/**
 * Gathers the context of a question. Caller-provided documents are always
 * kept; vector backends are tried in order until one answers. Small talk gets
 * no vector context, and vector results below the confidence threshold are
 * dropped. Never throws: a total backend failure yields the provided
 * documents only.
 */
public class RetrievalOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private static final String ELLIPSIS = "...";

    private final List<VectorIndex> backends;
    private final ResultCache resultCache;
    private final RetrievalProperties properties;
    private final SmallTalkDetector smallTalkDetector;

    public RetrievalOrchestrator(List<VectorIndex> backends, ResultCache resultCache,
            RetrievalProperties properties) {
        this.backends = List.copyOf(backends);
        this.resultCache = Objects.requireNonNull(resultCache, "resultCache");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.smallTalkDetector = new SmallTalkDetector(properties.getTrivialQueryMaxLength());
    }

    public RetrievalResult retrieve(String query, List<ContextDocument> providedDocuments, String conversationId) {
        List<RetrievedDocument> documents = new ArrayList<>();
        if (providedDocuments != null) {
            providedDocuments.forEach(document -> documents.add(RetrievedDocument.provided(document.toChunk())));
        }

        List<RetrievedDocument> vectorResults = searchBackends(query, properties.getTopK(),
                "conversation " + conversationId);
        if (!vectorResults.isEmpty() && smallTalkDetector.isSmallTalk(query)) {
            LOGGER.debug("Ignoring {} vector results for small talk in conversation {}", vectorResults.size(),
                    conversationId);
            vectorResults = List.of();
        }
        for (RetrievedDocument result : vectorResults) {
            if (result.score() >= properties.getHighConfidenceThreshold()) {
                documents.add(result);
            }
        }
        return assemble(documents);
    }

    /**
     * Plain search of the knowledge base: the first backend that answers wins.
     * Small-talk and confidence filters of conversation turns do not apply.
     */
    public List<RetrievedDocument> search(String query, int maxResults) {
        return searchBackends(query, maxResults, "knowledge base search");
    }

    private List<RetrievedDocument> searchBackends(String query, int k, String requester) {
        String cacheKey = "retrieval:" + k + ":" + query.strip().toLowerCase(Locale.ROOT);
        Optional<CachedSearch> cached = resultCache.get(cacheKey, CachedSearch.class);
        if (cached.isPresent()) {
            LOGGER.debug("Using cached search results for {}", requester);
            return cached.get().documents();
        }
        for (VectorIndex backend : backends) {
            try {
                List<RetrievedDocument> results = backend.search(query, k);
                resultCache.set(cacheKey, new CachedSearch(results), properties.getCacheTtl(),
                        properties.isPersistCachedResults());
                LOGGER.debug("{} returned {} results for {}", backend.origin(), results.size(), requester);
                return results;
            } catch (RuntimeException ex) {
                LOGGER.warn("Vector backend {} failed for {}: {}", backend.origin(), requester,
                        ex.getMessage());
            }
        }
        if (!backends.isEmpty()) {
            LOGGER.warn("All vector backends failed for {}, continuing without retrieved context", requester);
        }
        return List.of();
    }

    private RetrievalResult assemble(List<RetrievedDocument> documents) {
        if (documents.isEmpty()) {
            return RetrievalResult.empty();
        }
        StringBuilder context = new StringBuilder("Relevant context:\n");
        Set<String> sources = new LinkedHashSet<>();
        List<Excerpt> excerpts = new ArrayList<>();
        int position = 1;
        for (RetrievedDocument document : documents) {
            String excerpt = truncate(document.content().strip());
            String label = document.chunk().sourceLabel();
            context.append(position++).append(". ").append(excerpt).append(" (Source: ").append(label)
                    .append(")\n");
            sources.add(label);
            excerpts.add(new Excerpt(excerpt, document.source(), document.page()));
        }
        boolean onlyProvided = documents.stream().allMatch(document -> document.origin() == Origin.PROVIDED);
        LOGGER.debug("Assembled context from {} documents (provided only: {})", documents.size(), onlyProvided);
        return new RetrievalResult(context.toString(), new ArrayList<>(sources), excerpts, true, documents);
    }

    private String truncate(String text) {
        int max = properties.getMaxExcerptLength();
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + ELLIPSIS;
    }

    /**
     * Cached form of a vector search.
     */
    public record CachedSearch(List<RetrievedDocument> documents) {

        public CachedSearch {
            documents = List.copyOf(documents);
        }
    }
}
