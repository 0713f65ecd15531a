package dev.juridica.rag.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.juridica.rag.index.IndexingService;
import dev.juridica.rag.index.IndexingService.IndexingReport;
import dev.juridica.rag.retrieval.RetrievalOrchestrator;
import jakarta.validation.Valid;

/**
 * Feeds documents into the vector backends and searches them directly.
 */
@RestController
@RequestMapping(path = "/api/knowledge-base")
@Validated
public class KnowledgeBaseController {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeBaseController.class);

    private final IndexingService indexingService;
    private final RetrievalOrchestrator retrievalOrchestrator;

    public KnowledgeBaseController(IndexingService indexingService, RetrievalOrchestrator retrievalOrchestrator) {
        this.indexingService = indexingService;
        this.retrievalOrchestrator = retrievalOrchestrator;
    }

    /**
     * Indexes the documents. Answers 201 when at least one backend was updated
     * and 503 when every backend failed.
     */
    @PostMapping(path = "/documents", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IndexingReport> ingest(@Valid @RequestBody IngestRequest request) {
        IndexingReport report = indexingService.index(request.documents().stream()
                .map(KnowledgeDocument::toDocument)
                .toList());
        if (report.updated().isEmpty()) {
            LOGGER.error("No backend accepted {} documents, failed: {}", report.documents(), report.failed());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(report);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }

    @PostMapping(path = "/search", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchResponse search(@Valid @RequestBody SearchRequest request) {
        return SearchResponse.of(retrievalOrchestrator.search(request.query(), request.effectiveMaxResults()));
    }
}
