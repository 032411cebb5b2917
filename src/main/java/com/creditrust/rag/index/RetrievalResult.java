package com.creditrust.rag.index;

import java.util.List;

/**
 * Chunks ordered by descending score. An empty result is the explicit signal
 * that nothing relevant enough was found.
 */
public record RetrievalResult(List<ScoredChunk> chunks) {

    private static final RetrievalResult EMPTY = new RetrievalResult(List.of());

    public RetrievalResult {
        chunks = List.copyOf(chunks);
    }

    public static RetrievalResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }
}
