package com.creditrust.rag.ingest;

import java.util.Objects;

/**
 * A cleaned complaint narrative as delivered by the ingestion boundary.
 */
public record Document(String id, SourceMetadata source, String text) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
        source = source == null ? SourceMetadata.EMPTY : source;
    }
}
