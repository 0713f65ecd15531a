package dev.juridica.rag.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * File per key storage. The file name is the SHA-256 of the key, the body is
 * {@code {"value": ..., "timestamp": <epoch millis>, "ttl": <millis>}}.
 */
final class DiskCacheStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    DiskCacheStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    Optional<StoredEntry> read(String key) throws IOException {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), StoredEntry.class));
    }

    void write(String key, StoredEntry entry) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(key);
        Path temp = Files.createTempFile(directory, "entry", ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), entry);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    boolean delete(String key) throws IOException {
        return Files.deleteIfExists(fileFor(key));
    }

    void clear() throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        }
    }

    Path fileFor(String key) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return directory.resolve(HexFormat.of().formatHex(hash) + ".json");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    record StoredEntry(JsonNode value, long timestamp, long ttl) {
    }
}
