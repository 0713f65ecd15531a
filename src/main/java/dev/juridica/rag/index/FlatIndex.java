package dev.juridica.rag.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.chunking.Chunk;
import dev.juridica.rag.embedding.DeterministicEmbeddingProvider;
import dev.juridica.rag.embedding.EmbeddingProvider;
import dev.juridica.rag.embedding.Vectors;

/**
 * Exhaustive in-memory index over unit vectors. Search ranks by squared L2
 * distance, which on unit vectors equals {@code 2 - 2 cos}; the normalized
 * score is therefore {@code 1 - d / 4}.
 * <p>
 * Embedding failures during a build do not abort it: the failed batch gets
 * deterministic placeholder vectors and the index reports itself degraded.
 */
public class FlatIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlatIndex.class);

    static final String VECTORS_FILE = "vectors.bin";
    static final String CHUNKS_FILE = "chunks.json";

    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingProvider placeholderProvider;
    private final IndexProperties properties;
    private final ObjectMapper objectMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private List<Chunk> chunks = new ArrayList<>();
    private List<float[]> vectors = new ArrayList<>();
    private volatile boolean degraded;

    public FlatIndex(EmbeddingProvider embeddingProvider, IndexProperties properties, ObjectMapper objectMapper) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.placeholderProvider = new DeterministicEmbeddingProvider(embeddingProvider.dimensions());
        if (properties.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }

    /**
     * Replaces the whole content of the index.
     */
    public void rebuild(List<Chunk> newChunks) {
        degraded = false;
        List<float[]> newVectors = embedInBatches(newChunks);
        lock.writeLock().lock();
        try {
            chunks = new ArrayList<>(newChunks);
            vectors = new ArrayList<>(newVectors);
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.info("Rebuilt flat index with {} chunks{}", newChunks.size(), degraded ? " (degraded)" : "");
    }

    @Override
    public void upsert(List<Chunk> newChunks) {
        if (newChunks.isEmpty()) {
            return;
        }
        List<float[]> newVectors = embedInBatches(newChunks);
        Set<String> keys = new HashSet<>();
        newChunks.forEach(chunk -> keys.add(chunk.key()));
        int total;
        lock.writeLock().lock();
        try {
            List<Chunk> keptChunks = new ArrayList<>(chunks.size() + newChunks.size());
            List<float[]> keptVectors = new ArrayList<>(chunks.size() + newChunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                if (!keys.contains(chunks.get(i).key())) {
                    keptChunks.add(chunks.get(i));
                    keptVectors.add(vectors.get(i));
                }
            }
            keptChunks.addAll(newChunks);
            keptVectors.addAll(newVectors);
            chunks = keptChunks;
            vectors = keptVectors;
            total = keptChunks.size();
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.debug("Upserted {} chunks, flat index now holds {}", newChunks.size(), total);
    }

    @Override
    public List<RetrievedDocument> search(String query, int k, double threshold) {
        float[] queryVector = embedQuery(query);
        List<RetrievedDocument> ranked = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (int i = 0; i < chunks.size(); i++) {
                double distance = Vectors.squaredDistance(queryVector, vectors.get(i));
                ranked.add(new RetrievedDocument(chunks.get(i), RetrievedDocument.clamp(1.0d - distance / 4.0d),
                        distance, Origin.FLAT_INDEX));
            }
        } finally {
            lock.readLock().unlock();
        }
        ranked.sort(Comparator.comparingDouble(RetrievedDocument::rawScore));
        return SearchCandidates.select(ranked, k, threshold, comparator());
    }

    @Override
    public void persist() throws IOException {
        List<Chunk> chunkSnapshot;
        List<float[]> vectorSnapshot;
        lock.readLock().lock();
        try {
            chunkSnapshot = List.copyOf(chunks);
            vectorSnapshot = List.copyOf(vectors);
        } finally {
            lock.readLock().unlock();
        }
        Path directory = Path.of(properties.getFlatDirectory());
        Files.createDirectories(directory);
        try (DataOutputStream out = new DataOutputStream(
                new BufferedOutputStream(Files.newOutputStream(directory.resolve(VECTORS_FILE))))) {
            out.writeInt(vectorSnapshot.size());
            out.writeInt(embeddingProvider.dimensions());
            for (float[] vector : vectorSnapshot) {
                for (float value : vector) {
                    out.writeFloat(value);
                }
            }
        }
        objectMapper.writeValue(directory.resolve(CHUNKS_FILE).toFile(), chunkSnapshot);
        LOGGER.info("Persisted flat index with {} chunks to {}", chunkSnapshot.size(), directory);
    }

    @Override
    public void load() throws IOException {
        Path directory = Path.of(properties.getFlatDirectory());
        Path vectorFile = directory.resolve(VECTORS_FILE);
        Path chunkFile = directory.resolve(CHUNKS_FILE);
        if (!Files.exists(vectorFile) || !Files.exists(chunkFile)) {
            LOGGER.info("No flat index found in {}, starting empty", directory);
            return;
        }
        List<float[]> loadedVectors = new ArrayList<>();
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(vectorFile)))) {
            int count = in.readInt();
            int dimension = in.readInt();
            if (dimension != embeddingProvider.dimensions()) {
                throw new IllegalArgumentException("Persisted flat index has dimension " + dimension
                        + " but the embedding provider produces " + embeddingProvider.dimensions());
            }
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = in.readFloat();
                }
                loadedVectors.add(vector);
            }
        }
        List<Chunk> loadedChunks = objectMapper.readValue(chunkFile.toFile(), new TypeReference<List<Chunk>>() {
        });
        if (loadedChunks.size() != loadedVectors.size()) {
            throw new IOException("Flat index files are inconsistent: " + loadedChunks.size() + " chunks for "
                    + loadedVectors.size() + " vectors");
        }
        lock.writeLock().lock();
        try {
            chunks = new ArrayList<>(loadedChunks);
            vectors = loadedVectors;
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.info("Loaded flat index with {} chunks from {}", loadedChunks.size(), directory);
    }

    @Override
    public Origin origin() {
        return Origin.FLAT_INDEX;
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ScoreComparator comparator() {
        return ScoreComparator.MAX_DISTANCE;
    }

    @Override
    public double defaultThreshold() {
        return properties.getFlatThreshold();
    }

    public boolean isDegraded() {
        return degraded;
    }

    private List<float[]> embedInBatches(List<Chunk> toEmbed) {
        List<float[]> result = new ArrayList<>(toEmbed.size());
        int batchSize = properties.getBatchSize();
        for (int start = 0; start < toEmbed.size(); start += batchSize) {
            if (start > 0) {
                pauseBetweenBatches();
            }
            List<String> texts = toEmbed.subList(start, Math.min(start + batchSize, toEmbed.size())).stream()
                    .map(Chunk::content)
                    .toList();
            result.addAll(embedBatch(texts, start));
        }
        return result;
    }

    private List<float[]> embedBatch(List<String> texts, int offset) {
        List<float[]> batch;
        try {
            batch = embeddingProvider.embedAll(texts);
        } catch (RuntimeException ex) {
            LOGGER.warn("Embedding batch at offset {} failed, using placeholder vectors: {}", offset, ex.getMessage());
            degraded = true;
            return placeholderProvider.embedAll(texts);
        }
        List<float[]> normalized = new ArrayList<>(batch.size());
        for (float[] vector : batch) {
            if (vector.length != embeddingProvider.dimensions()) {
                throw new IllegalArgumentException("Embedding dimension " + vector.length + " does not match index "
                        + "dimension " + embeddingProvider.dimensions());
            }
            normalized.add(Vectors.normalize(vector.clone()));
        }
        return normalized;
    }

    private float[] embedQuery(String query) {
        try {
            return Vectors.normalize(embeddingProvider.embed(query).clone());
        } catch (RuntimeException ex) {
            LOGGER.warn("Query embedding failed, searching with a placeholder vector: {}", ex.getMessage());
            return placeholderProvider.embed(query);
        }
    }

    private void pauseBetweenBatches() {
        long pause = properties.getBatchPause().toMillis();
        if (pause <= 0) {
            return;
        }
        try {
            Thread.sleep(pause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing embedding batches", ex);
        }
    }
}
