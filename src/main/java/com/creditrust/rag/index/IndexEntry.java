package com.creditrust.rag.index;

import java.util.Objects;

import com.creditrust.rag.ingest.Chunk;

/**
 * A chunk paired with its embedding.
 */
public record IndexEntry(Chunk chunk, float[] embedding) {

    public IndexEntry {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(embedding, "embedding");
    }
}
