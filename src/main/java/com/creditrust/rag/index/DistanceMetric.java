package com.creditrust.rag.index;

/**
 * Distance metric an index is built with. Scores are normalised so that a
 * higher value always means more similar.
 */
public enum DistanceMetric {

    /**
     * Cosine similarity in {@code [-1, 1]}. Zero vectors score {@code 0}.
     */
    COSINE {
        @Override
        double score(float[] query, double queryNorm, float[] vector, double vectorNorm) {
            if (queryNorm == 0.0d || vectorNorm == 0.0d) {
                return 0.0d;
            }
            double dot = 0.0d;
            for (int i = 0; i < query.length; i++) {
                dot += (double) query[i] * vector[i];
            }
            return dot / (queryNorm * vectorNorm);
        }
    },

    /**
     * {@code 1 / (1 + d)} where {@code d} is the Euclidean distance, in
     * {@code (0, 1]}.
     */
    EUCLIDEAN {
        @Override
        double score(float[] query, double queryNorm, float[] vector, double vectorNorm) {
            double sum = 0.0d;
            for (int i = 0; i < query.length; i++) {
                double diff = (double) query[i] - vector[i];
                sum += diff * diff;
            }
            return 1.0d / (1.0d + Math.sqrt(sum));
        }
    };

    abstract double score(float[] query, double queryNorm, float[] vector, double vectorNorm);

    static double norm(float[] vector) {
        double sum = 0.0d;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }
}
