package com.creditrust.rag.index;

import java.util.List;

/**
 * Immutable set of embedded chunks searchable under a single distance metric.
 * Implementations are safe for concurrent searches.
 */
public interface VectorIndex {

    int dimension();

    DistanceMetric metric();

    int size();

    /**
     * Version tag shared by every chunk in the index.
     */
    String corpusVersion();

    /**
     * Find the {@code k} entries most similar to the query.
     *
     * @param query embedding of the query, of {@link #dimension()} entries
     * @param k     the maximum amount of results, at least 1
     * @return results in non-increasing score order, fewer than {@code k} only
     *         when the index holds fewer entries
     */
    RetrievalResult search(float[] query, int k);

    /**
     * All entries in insertion order.
     */
    List<IndexEntry> entries();

    /**
     * Whether search results are approximate.
     */
    default boolean approximate() {
        return false;
    }
}
