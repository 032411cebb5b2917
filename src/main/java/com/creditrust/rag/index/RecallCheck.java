package com.creditrust.rag.index;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Measures how many of the reference top-k results a candidate index returns.
 */
public final class RecallCheck {

    private RecallCheck() {
    }

    /**
     * @return mean recall@k over the queries, {@code 1.0} when there are no
     *         queries
     */
    public static double measure(VectorIndex reference, VectorIndex candidate, List<float[]> queries, int k) {
        if (queries.isEmpty()) {
            return 1.0d;
        }
        double total = 0.0d;
        for (float[] query : queries) {
            Set<String> expected = ids(reference.search(query, k));
            Set<String> actual = ids(candidate.search(query, k));
            long hits = actual.stream().filter(expected::contains).count();
            total += expected.isEmpty() ? 1.0d : (double) hits / expected.size();
        }
        return total / queries.size();
    }

    private static Set<String> ids(RetrievalResult result) {
        return result.chunks().stream().map(scored -> scored.chunk().id()).collect(Collectors.toSet());
    }
}
