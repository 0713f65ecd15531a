package dev.juridica.rag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits documents into overlapping chunks that follow the structure of legal
 * texts: sections first, then paragraphs, lines, sentences, clauses,
 * enumerations, words and finally characters.
 */
public class ChunkingEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkingEngine.class);

    static final List<String> SEPARATORS = List.of("\n\n\n", "\n\n", "\n", ". ", "; ", ", ", " ", "");

    private static final Pattern BLANK_LINES = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n(?:[ \\t\\x0B\\f\\r]*\\n)*");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");

    private final int maxChunkChars;
    private final int minChunkSize;
    private final RecursiveTextSplitter splitter;

    public ChunkingEngine(ChunkingProperties properties) {
        Objects.requireNonNull(properties, "properties");
        this.maxChunkChars = properties.getChunkSize() * properties.getCharsPerToken();
        this.minChunkSize = properties.getMinChunkSize();
        this.splitter = new RecursiveTextSplitter(SEPARATORS, maxChunkChars,
                properties.getChunkOverlap() * properties.getCharsPerToken());
    }

    /**
     * Splits one document. Short documents are returned as a single unchanged
     * chunk; splitting failures fall back to the same single chunk.
     */
    public List<Chunk> chunk(Document document) {
        Objects.requireNonNull(document, "document");
        if (document.content().isBlank()) {
            LOGGER.warn("Skipping empty document from {}", document.source());
            return List.of();
        }
        if (document.content().length() <= maxChunkChars) {
            return List.of(Chunk.of(document));
        }
        try {
            List<String> pieces = splitter.split(document.content());
            List<Chunk> chunks = new ArrayList<>(pieces.size());
            for (int i = 0; i < pieces.size(); i++) {
                chunks.add(Chunk.of(document, pieces.get(i), i, pieces.size()));
            }
            LOGGER.debug("Split {} into {} chunks", document.source(), chunks.size());
            return chunks;
        } catch (RuntimeException ex) {
            LOGGER.error("Chunking of {} failed, keeping the document as one chunk: {}", document.source(),
                    ex.getMessage(), ex);
            return List.of(Chunk.of(document));
        }
    }

    public List<Chunk> mergeSmall(List<Chunk> chunks) {
        return mergeSmall(chunks, minChunkSize);
    }

    /**
     * Coalesces every chunk shorter than {@code minSize} with its successor in a
     * single forward pass. The last chunk may therefore stay below the minimum.
     */
    public List<Chunk> mergeSmall(List<Chunk> chunks, int minSize) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        List<Chunk> result = new ArrayList<>();
        Chunk current = null;
        for (Chunk chunk : chunks) {
            if (current == null) {
                current = chunk;
            } else if (current.content().length() < minSize) {
                current = current.absorb(chunk);
            } else {
                result.add(current);
                current = chunk;
            }
        }
        result.add(current);
        return result;
    }

    /**
     * Normalizes and chunks a batch of documents.
     */
    public List<Chunk> process(List<Document> documents) {
        List<Chunk> chunks = new ArrayList<>();
        for (Document document : documents) {
            chunks.addAll(chunk(document.withContent(normalize(document.content()))));
        }
        LOGGER.info("Produced {} chunks from {} documents", chunks.size(), documents.size());
        return chunks;
    }

    static String normalize(String text) {
        String cleaned = CONTROL_CHARACTERS.matcher(text).replaceAll("");
        return BLANK_LINES.matcher(cleaned).replaceAll("\n\n").strip();
    }
}
