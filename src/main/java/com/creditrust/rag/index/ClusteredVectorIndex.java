package com.creditrust.rag.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximate index that partitions the vectors of an {@link ExactVectorIndex}
 * with k-means and only scans the clusters whose centroids are closest to the
 * query. Centroids are seeded deterministically so that two builds over the
 * same entries produce the same partition.
 */
public final class ClusteredVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusteredVectorIndex.class);

    private static final int MAX_ITERATIONS = 20;

    private final ExactVectorIndex exact;
    private final float[][] centroids;
    private final double[] centroidNorms;
    private final int[][] members;
    private final int probes;

    private ClusteredVectorIndex(ExactVectorIndex exact, float[][] centroids, int[][] members, int probes) {
        this.exact = exact;
        this.centroids = centroids;
        this.members = members;
        this.probes = probes;
        this.centroidNorms = new double[centroids.length];
        for (int i = 0; i < centroids.length; i++) {
            centroidNorms[i] = DistanceMetric.norm(centroids[i]);
        }
    }

    public static ClusteredVectorIndex build(ExactVectorIndex exact, int clusters, int probes) {
        Objects.requireNonNull(exact, "exact");
        if (clusters < 1 || probes < 1) {
            throw new IllegalArgumentException("clusters and probes must be positive");
        }
        int size = exact.size();
        int effectiveClusters = Math.min(clusters, size);
        float[][] points = new float[size][];
        for (int i = 0; i < size; i++) {
            points[i] = exact.metric() == DistanceMetric.COSINE ? normalized(exact.vector(i)) : exact.vector(i);
        }
        float[][] centroids = new float[effectiveClusters][];
        for (int c = 0; c < effectiveClusters; c++) {
            centroids[c] = points[(int) ((long) c * size / effectiveClusters)].clone();
        }
        int[] assignment = new int[size];
        Arrays.fill(assignment, -1);
        int iterations = 0;
        boolean changed = true;
        while (changed && iterations < MAX_ITERATIONS) {
            iterations++;
            changed = false;
            for (int i = 0; i < size; i++) {
                int nearest = nearestCentroid(points[i], centroids);
                if (nearest != assignment[i]) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            recomputeCentroids(points, assignment, centroids);
        }
        int[][] members = new int[effectiveClusters][];
        for (int c = 0; c < effectiveClusters; c++) {
            int cluster = c;
            members[c] = IntStream.range(0, size).filter(i -> assignment[i] == cluster).toArray();
        }
        LOGGER.info("Clustered {} vectors into {} clusters after {} k-means iterations (probes={})", size,
                effectiveClusters, iterations, probes);
        return new ClusteredVectorIndex(exact, centroids, members, Math.min(probes, effectiveClusters));
    }

    @Override
    public int dimension() {
        return exact.dimension();
    }

    @Override
    public DistanceMetric metric() {
        return exact.metric();
    }

    @Override
    public int size() {
        return exact.size();
    }

    @Override
    public String corpusVersion() {
        return exact.corpusVersion();
    }

    @Override
    public RetrievalResult search(float[] query, int k) {
        exact.checkQuery(query, k);
        double queryNorm = DistanceMetric.norm(query);
        Integer[] order = new Integer[centroids.length];
        double[] scores = new double[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            order[c] = c;
            scores[c] = exact.metric().score(query, queryNorm, centroids[c], centroidNorms[c]);
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer c) -> scores[c]).reversed()
                .thenComparingInt(c -> c));
        // probe further clusters until k candidates are available
        int wanted = Math.min(k, exact.size());
        List<int[]> probed = new ArrayList<>(probes);
        int candidates = 0;
        for (int p = 0; p < order.length && (p < probes || candidates < wanted); p++) {
            probed.add(members[order[p]]);
            candidates += members[order[p]].length;
        }
        int[] ordinals = new int[candidates];
        int offset = 0;
        for (int[] cluster : probed) {
            System.arraycopy(cluster, 0, ordinals, offset, cluster.length);
            offset += cluster.length;
        }
        return exact.scan(query, k, ordinals);
    }

    @Override
    public List<IndexEntry> entries() {
        return exact.entries();
    }

    @Override
    public boolean approximate() {
        return true;
    }

    /**
     * The exact index this index was derived from.
     */
    public ExactVectorIndex exact() {
        return exact;
    }

    private static int nearestCentroid(float[] point, float[][] centroids) {
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int c = 0; c < centroids.length; c++) {
            double distance = 0.0d;
            for (int d = 0; d < point.length; d++) {
                double diff = (double) point[d] - centroids[c][d];
                distance += diff * diff;
            }
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    private static void recomputeCentroids(float[][] points, int[] assignment, float[][] centroids) {
        int dimension = points[0].length;
        double[][] sums = new double[centroids.length][dimension];
        int[] counts = new int[centroids.length];
        for (int i = 0; i < points.length; i++) {
            counts[assignment[i]]++;
            for (int d = 0; d < dimension; d++) {
                sums[assignment[i]][d] += points[i][d];
            }
        }
        for (int c = 0; c < centroids.length; c++) {
            // empty clusters keep their previous centroid
            if (counts[c] == 0) {
                continue;
            }
            for (int d = 0; d < dimension; d++) {
                centroids[c][d] = (float) (sums[c][d] / counts[c]);
            }
        }
    }

    private static float[] normalized(float[] vector) {
        double norm = DistanceMetric.norm(vector);
        float[] copy = vector.clone();
        if (norm > 0) {
            for (int i = 0; i < copy.length; i++) {
                copy[i] = (float) (copy[i] / norm);
            }
        }
        return copy;
    }
}
