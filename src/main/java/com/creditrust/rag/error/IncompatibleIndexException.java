package com.creditrust.rag.error;

/**
 * A persisted index was written with a different dimension or metric than the
 * one configured.
 */
public class IncompatibleIndexException extends IndexCorruptionException {

    public IncompatibleIndexException(String message) {
        super(message);
    }
}
