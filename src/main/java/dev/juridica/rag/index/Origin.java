package dev.juridica.rag.index;

/**
 * Where a retrieved document came from.
 */
public enum Origin {
    /** Supplied by the caller with the query. */
    PROVIDED,
    /** Rebuildable in-memory flat index. */
    FLAT_INDEX,
    /** Durable, incrementally updated collection. */
    PERSISTENT_COLLECTION
}
