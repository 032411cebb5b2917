package com.creditrust.rag.index;

import java.time.Instant;

/**
 * Immutable, point-in-time published version of the vector index.
 */
public record IndexSnapshot(long version, VectorIndex index, Instant publishedAt) {
}
