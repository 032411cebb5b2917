package com.creditrust.rag.index;

/**
 * Summary of a completed build.
 */
public record IndexBuildReport(
        long snapshotVersion,
        int documents,
        int rejectedDocuments,
        int chunks,
        int dimension,
        DistanceMetric metric,
        String corpusVersion,
        boolean approximate,
        boolean persisted,
        long durationMillis) {
}
