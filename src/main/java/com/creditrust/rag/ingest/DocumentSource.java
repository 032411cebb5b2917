package com.creditrust.rag.ingest;

import java.util.List;

/**
 * Ingestion boundary delivering cleaned complaint narratives.
 */
@FunctionalInterface
public interface DocumentSource {

    /**
     * Load all usable documents. Malformed records are skipped by the
     * implementation rather than failing the whole batch.
     *
     * @return the documents in source order
     */
    List<Document> load();
}
