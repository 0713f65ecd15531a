package dev.juridica.rag.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns answers into downloadable documents when the question asks for one.
 * The file name is reserved synchronously and rendering happens on the
 * executor; a rendering failure is logged and never affects the answer.
 */
public class AnswerDocumentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerDocumentService.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern FILENAME = Pattern.compile("[0-9a-f]{32}_\\d{8}_\\d{6}\\.(pdf|docx)");
    private static final int TITLE_LENGTH = 80;

    private final DocumentRequestDetector detector;
    private final DocumentGenerator generator;
    private final Executor executor;
    private final DocumentProperties properties;
    private final Clock clock;

    public AnswerDocumentService(DocumentRequestDetector detector, DocumentGenerator generator, Executor executor,
            DocumentProperties properties, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<GeneratedDocument> generateIfRequested(String question, String answer, List<String> sources,
            String conversationId) {
        DocumentRequest request = detector.detect(question);
        if (!request.isRequest()) {
            return Optional.empty();
        }
        if (!generator.supports(request.format())) {
            LOGGER.info("Conversation {} asked for a {} document, which is not supported", conversationId,
                    request.format().extension());
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        String filename = UUID.randomUUID().toString().replace("-", "") + "_" + TIMESTAMP.format(now) + "."
                + request.format().extension();
        Path target = Path.of(properties.getOutputDir()).resolve(filename);
        DocumentContent content = new DocumentContent(title(question), question, answer, sources, now);
        try {
            executor.execute(() -> render(content, target, conversationId));
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Document for conversation {} not scheduled: {}", conversationId, ex.getMessage());
            return Optional.empty();
        }
        return Optional.of(new GeneratedDocument(request.format().extension(), filename,
                properties.getBaseUrl() + filename));
    }

    /**
     * Resolves a previously generated document by file name. Names that were
     * not produced by this service are rejected.
     */
    public Optional<Path> find(String filename) {
        if (filename == null || !FILENAME.matcher(filename).matches()) {
            return Optional.empty();
        }
        Path file = Path.of(properties.getOutputDir()).resolve(filename);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    private void render(DocumentContent content, Path target, String conversationId) {
        try {
            Files.createDirectories(target.getParent());
            generator.render(content, target);
            LOGGER.info("Rendered document {} for conversation {}", target.getFileName(), conversationId);
        } catch (IOException | RuntimeException ex) {
            LOGGER.error("Rendering document {} for conversation {} failed: {}", target.getFileName(),
                    conversationId, ex.getMessage(), ex);
        }
    }

    private String title(String question) {
        String title = question.strip().replaceAll("\\s+", " ");
        return title.length() > TITLE_LENGTH ? title.substring(0, TITLE_LENGTH) + "..." : title;
    }
}
