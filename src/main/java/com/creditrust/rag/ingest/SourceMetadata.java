package com.creditrust.rag.ingest;

import java.time.LocalDate;

/**
 * Attributes of the complaint a narrative was taken from. Every field may be
 * {@code null} when the upstream record did not carry it.
 */
public record SourceMetadata(String product, LocalDate submittedOn, String company) {

    public static final SourceMetadata EMPTY = new SourceMetadata(null, null, null);
}
