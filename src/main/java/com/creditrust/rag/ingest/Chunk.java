package com.creditrust.rag.ingest;

import java.util.Objects;

/**
 * Atomic retrievable unit: a bounded, possibly overlapping slice of a
 * document. The {@code version} tag identifies the chunking and embedding
 * parameters the chunk was produced under.
 */
public record Chunk(String id, String documentId, TextSpan span, String text, SourceMetadata source,
        String version) {

    public Chunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(version, "version");
        source = source == null ? SourceMetadata.EMPTY : source;
    }
}
