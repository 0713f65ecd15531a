package dev.juridica.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

class ChunkingEngineTest {

    private static ChunkingEngine engine(int chunkTokens, int overlapTokens) {
        ChunkingProperties properties = new ChunkingProperties();
        properties.setChunkSize(chunkTokens);
        properties.setChunkOverlap(overlapTokens);
        properties.setCharsPerToken(4);
        properties.setMinChunkSize(100);
        return new ChunkingEngine(properties);
    }

    private static String paragraphs(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "Article " + i + ". La Junior-Entreprise respecte ses statuts; elle tient ses comptes.")
                .collect(Collectors.joining("\n\n"));
    }

    @Test
    void returnsShortDocumentAsSingleUnchangedChunk() {
        Document document = new Document("Article 1. Objet de l'association.", "statuts.pdf", 2,
                Map.of("lang", "fr"));

        List<Chunk> chunks = engine(300, 50).chunk(document);

        assertThat(chunks).hasSize(1);
        Chunk chunk = chunks.get(0);
        assertThat(chunk.content()).isEqualTo(document.content());
        assertThat(chunk.source()).isEqualTo("statuts.pdf");
        assertThat(chunk.page()).isEqualTo(2);
        assertThat(chunk.metadata()).containsEntry("lang", "fr");
        assertThat(chunk.chunkId()).isZero();
        assertThat(chunk.totalChunks()).isEqualTo(1);
        assertThat(chunk.merged()).isFalse();
    }

    @Test
    void ignoresBlankDocuments() {
        assertThat(engine(300, 50).chunk(new Document("  \n\t ", "empty.txt"))).isEmpty();
    }

    @Test
    void splitsLongDocumentIntoNumberedChunksWithinSize() {
        String text = paragraphs(40);

        List<Chunk> chunks = engine(25, 5).chunk(new Document(text, "guide.pdf", 7));

        assertThat(chunks).hasSizeGreaterThan(1);
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            assertThat(chunk.chunkId()).isEqualTo(i);
            assertThat(chunk.totalChunks()).isEqualTo(chunks.size());
            assertThat(chunk.content().length()).isLessThanOrEqualTo(100);
            assertThat(chunk.source()).isEqualTo("guide.pdf");
            assertThat(chunk.page()).isEqualTo(7);
        }
    }

    @Test
    void keepsEverySeparatorWhenChunksDoNotOverlap() {
        String text = paragraphs(30);

        List<Chunk> chunks = engine(25, 0).chunk(new Document(text, "guide.pdf"));

        String rebuilt = chunks.stream().map(Chunk::content).collect(Collectors.joining());
        assertThat(rebuilt).isEqualTo(text);
    }

    @Test
    void cutsAtParagraphBoundariesFirst() {
        String text = paragraphs(10);

        List<Chunk> chunks = engine(25, 0).chunk(new Document(text, "guide.pdf"));

        assertThat(chunks.get(0).content()).startsWith("Article 0.");
        chunks.subList(1, chunks.size()).forEach(chunk -> assertThat(chunk.content()).startsWith("\n\nArticle "));
    }

    @Test
    void overlappingChunksShareText() {
        String text = "mot ".repeat(200);

        List<Chunk> chunks = engine(25, 10).chunk(new Document(text, "mots.txt"));

        assertThat(chunks).hasSizeGreaterThan(2);
        String first = chunks.get(0).content();
        String second = chunks.get(1).content();
        assertThat(second).startsWith(first.substring(first.length() - 40));
    }

    @Test
    void mergesSmallChunksInOnePass() {
        Document document = new Document("x", "notes.txt");
        List<Chunk> chunks = List.of(
                Chunk.of(document, "a".repeat(30), 0, 4),
                Chunk.of(document, "b".repeat(40), 1, 4),
                Chunk.of(document, "c".repeat(200), 2, 4),
                Chunk.of(document, "d".repeat(10), 3, 4));

        List<Chunk> merged = engine(300, 50).mergeSmall(chunks, 100);

        assertThat(merged).hasSize(2);
        assertThat(merged.get(0).content()).isEqualTo("a".repeat(30) + "b".repeat(40) + "c".repeat(200));
        assertThat(merged.get(0).merged()).isTrue();
        assertThat(merged.get(0).chunkIds()).containsExactly(0, 1, 2);
        assertThat(merged.get(1).content()).isEqualTo("d".repeat(10));
        assertThat(merged.get(1).merged()).isFalse();
        int before = chunks.stream().mapToInt(chunk -> chunk.content().length()).sum();
        int after = merged.stream().mapToInt(chunk -> chunk.content().length()).sum();
        assertThat(after).isEqualTo(before);
    }

    @Test
    void mergeSmallOfNothingIsEmpty() {
        assertThat(engine(300, 50).mergeSmall(List.of(), 100)).isEmpty();
    }

    @Test
    void processNormalizesBlankRunsAndControlCharacters() {
        List<Chunk> chunks = engine(300, 50).process(List.of(
                new Document("Titre\r\n\n\n\n  \nTexte\u0007 final", "a.txt"),
                new Document("   ", "b.txt")));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).content()).isEqualTo("Titre\n\nTexte final");
    }
}
