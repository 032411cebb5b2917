package com.creditrust.rag.index;

import java.time.Instant;

/**
 * Read-only view of the registry for the status endpoint. Fields describing
 * the index are {@code null} unless the state is {@code READY}.
 */
public record IndexStatus(
        IndexRegistry.Status state,
        Long version,
        Integer size,
        Integer dimension,
        DistanceMetric metric,
        String corpusVersion,
        Boolean approximate,
        Instant publishedAt,
        String problem) {
}
