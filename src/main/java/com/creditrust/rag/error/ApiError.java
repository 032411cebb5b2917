package com.creditrust.rag.error;

import java.time.Instant;

/**
 * JSON body returned for failed requests. {@code errorId} is also written to
 * the log so a report can be matched with the server side trace.
 */
public record ApiError(String errorId, String code, String message, String path, Instant timestamp) {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";
    public static final String INVALID_DATA = "INVALID_DATA";
    public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_UNAVAILABLE";
    public static final String GENERATION_UNAVAILABLE = "GENERATION_UNAVAILABLE";
    public static final String INDEX_CORRUPTED = "INDEX_CORRUPTED";
    public static final String INDEX_NOT_READY = "INDEX_NOT_READY";
    public static final String INDEX_BUILD_IN_PROGRESS = "INDEX_BUILD_IN_PROGRESS";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
