package dev.juridica.rag.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import dev.juridica.rag.chunking.Chunk;

/**
 * Conjunction of equality predicates on {@code source}, {@code page} or any
 * metadata key of a chunk.
 */
public record MetadataFilter(Map<String, Object> equalities) {

    public static final String SOURCE = "source";
    public static final String PAGE = "page";

    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    public MetadataFilter {
        equalities = Collections.unmodifiableMap(new LinkedHashMap<>(equalities));
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter where(String key, Object value) {
        return NONE.and(key, value);
    }

    public MetadataFilter and(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(equalities);
        copy.put(Objects.requireNonNull(key, "key"), value);
        return new MetadataFilter(copy);
    }

    public boolean isEmpty() {
        return equalities.isEmpty();
    }

    Object source() {
        return equalities.get(SOURCE);
    }

    Object page() {
        return equalities.get(PAGE);
    }

    /**
     * Predicates on metadata keys other than source and page with a non-null
     * expected value, in insertion order.
     */
    Map<String, Object> metadataEqualities() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        equalities.forEach((key, value) -> {
            if (!SOURCE.equals(key) && !PAGE.equals(key) && value != null) {
                metadata.put(key, value);
            }
        });
        return metadata;
    }

    /**
     * Whether the chunk satisfies the metadata predicates. Source and page are
     * evaluated by the database and skipped here.
     */
    boolean matchesMetadata(Chunk chunk) {
        for (Map.Entry<String, Object> entry : equalities.entrySet()) {
            if (SOURCE.equals(entry.getKey()) || PAGE.equals(entry.getKey())) {
                continue;
            }
            Object actual = chunk.metadata().get(entry.getKey());
            if (actual == null ? entry.getValue() != null
                    : !String.valueOf(actual).equals(String.valueOf(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }
}
