package dev.juridica.rag.conversation;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import dev.juridica.rag.document.AnswerDocumentService;
import dev.juridica.rag.persistence.ConversationNotFoundException;
import dev.juridica.rag.persistence.ConversationSummary;
import dev.juridica.rag.persistence.PersistMode;
import dev.juridica.rag.persistence.TurnPersistenceException;
import jakarta.validation.Valid;

/**
 * REST endpoints of the conversation engine.
 */
@RestController
@RequestMapping(path = "/api/chat")
@Validated
public class ConversationController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationOrchestrator orchestrator;
    private final AnswerDocumentService documentService;

    public ConversationController(ConversationOrchestrator orchestrator, AnswerDocumentService documentService) {
        this.orchestrator = orchestrator;
        this.documentService = documentService;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public QueryResponse query(@Valid @RequestBody ChatRequest request) {
        return orchestrator.processQuery(new QueryRequest(request.query(), request.conversationId(),
                request.userId(), request.contextDocuments(), PersistMode.AUTO_CREATE));
    }

    @PostMapping(path = "/continue/{conversationId}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public QueryResponse continueConversation(@PathVariable String conversationId,
            @Valid @RequestBody ChatRequest request) {
        return orchestrator.processQuery(new QueryRequest(request.query(), conversationId, request.userId(),
                request.contextDocuments(), PersistMode.CONTINUE_EXISTING));
    }

    @GetMapping(path = "/history/{conversationId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<HistoryEntry> history(@PathVariable String conversationId) {
        return orchestrator.getHistory(conversationId);
    }

    @DeleteMapping(path = "/history/{conversationId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> clear(@PathVariable String conversationId) {
        return Map.of("conversationId", conversationId, "cleared", orchestrator.clear(conversationId));
    }

    @PostMapping(path = "/conversations", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ConversationSummary createConversation(@RequestParam(required = false) Long userId) {
        return orchestrator.createConversation(userId);
    }

    @GetMapping(path = "/conversations", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ConversationSummary> conversations(@RequestParam Long userId) {
        return orchestrator.listConversations(userId);
    }

    @GetMapping(path = "/documents/{filename}")
    public ResponseEntity<Resource> document(@PathVariable String filename) {
        return documentService.find(filename)
                .map(this::download)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(ConversationNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ConversationNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(TurnPersistenceException.class)
    public ResponseEntity<Map<String, String>> persistenceFailed(TurnPersistenceException ex) {
        LOGGER.error("Request failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", ex.getMessage()));
    }

    private ResponseEntity<Resource> download(Path file) {
        MediaType type = file.getFileName().toString().endsWith(".pdf")
                ? MediaType.APPLICATION_PDF
                : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.getFileName() + "\"")
                .body(new FileSystemResource(file));
    }
}
