package com.creditrust.rag.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which index gets published for a freshly built or loaded exact
 * index. When enabled, a {@link ClusteredVectorIndex} replaces the exact one
 * only if its recall against the exact scan reaches {@code minRecall} on
 * sample queries drawn from the stored vectors.
 */
public class ApproximateIndexFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApproximateIndexFactory.class);

    private static final int SAMPLE_QUERIES = 64;
    private static final int RECALL_K = 10;

    private final boolean enabled;
    private final int clusters;
    private final int probes;
    private final double minRecall;

    public ApproximateIndexFactory(boolean enabled, int clusters, int probes, double minRecall) {
        this.enabled = enabled;
        this.clusters = clusters;
        this.probes = probes;
        this.minRecall = minRecall;
    }

    public static ApproximateIndexFactory disabled() {
        return new ApproximateIndexFactory(false, 1, 1, 1.0d);
    }

    public VectorIndex forServing(ExactVectorIndex exact) {
        if (!enabled) {
            return exact;
        }
        int clusterCount = clusters > 0 ? clusters : Math.max(1, (int) Math.round(Math.sqrt(exact.size())));
        ClusteredVectorIndex clustered = ClusteredVectorIndex.build(exact, clusterCount, probes);
        double recall = RecallCheck.measure(exact, clustered, sampleQueries(exact), Math.min(RECALL_K, exact.size()));
        if (recall < minRecall) {
            LOGGER.warn("Approximate index recall {} is below the required {}; serving the exact index",
                    String.format(Locale.ROOT, "%.3f", recall), minRecall);
            return exact;
        }
        LOGGER.info("Serving approximate index with recall {}", String.format(Locale.ROOT, "%.3f", recall));
        return clustered;
    }

    private List<float[]> sampleQueries(ExactVectorIndex exact) {
        int count = Math.min(SAMPLE_QUERIES, exact.size());
        List<float[]> queries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            queries.add(exact.vector((int) ((long) i * exact.size() / count)));
        }
        return queries;
    }
}
