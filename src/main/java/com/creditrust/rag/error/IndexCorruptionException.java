package com.creditrust.rag.error;

/**
 * A persisted index failed its integrity or version checks. Queries are refused
 * until the index has been rebuilt.
 */
public class IndexCorruptionException extends RagException {

    public IndexCorruptionException(String message) {
        super(message);
    }

    public IndexCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
