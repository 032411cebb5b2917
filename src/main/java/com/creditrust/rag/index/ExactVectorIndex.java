package com.creditrust.rag.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.error.DimensionMismatchException;
import com.creditrust.rag.error.EmptyInputException;
import com.creditrust.rag.ingest.Chunk;

/**
 * Brute-force nearest neighbour index. Every search scans all vectors and
 * keeps the best {@code k} in a bounded heap; it is the reference the
 * approximate index is verified against.
 */
public final class ExactVectorIndex implements VectorIndex {

    private static final Comparator<Candidate> BEST_FIRST = Comparator.comparingDouble(Candidate::score).reversed()
            .thenComparingInt(Candidate::ordinal);

    private final DistanceMetric metric;
    private final int dimension;
    private final String corpusVersion;
    private final List<Chunk> chunks;
    private final float[][] vectors;
    private final double[] norms;

    private ExactVectorIndex(DistanceMetric metric, int dimension, String corpusVersion, List<Chunk> chunks,
            float[][] vectors) {
        this.metric = metric;
        this.dimension = dimension;
        this.corpusVersion = corpusVersion;
        this.chunks = chunks;
        this.vectors = vectors;
        this.norms = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            norms[i] = DistanceMetric.norm(vectors[i]);
        }
    }

    /**
     * Build an index from the given pairs. The first embedding fixes the
     * dimension; every chunk must carry the same version tag.
     *
     * @throws EmptyInputException        if {@code pairs} is empty
     * @throws DimensionMismatchException if an embedding disagrees with the
     *                                    first observed dimension
     */
    public static ExactVectorIndex build(Iterable<IndexEntry> pairs, DistanceMetric metric) {
        Objects.requireNonNull(pairs, "pairs");
        Objects.requireNonNull(metric, "metric");
        List<Chunk> chunks = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        int dimension = -1;
        String version = null;
        for (IndexEntry entry : pairs) {
            float[] embedding = entry.embedding();
            if (dimension < 0) {
                dimension = embedding.length;
                version = entry.chunk().version();
            } else if (embedding.length != dimension) {
                throw new DimensionMismatchException(dimension, embedding.length);
            }
            if (!version.equals(entry.chunk().version())) {
                throw new ConfigurationException("Chunk " + entry.chunk().id() + " has version '"
                        + entry.chunk().version() + "' but the index is being built for '" + version + "'");
            }
            chunks.add(entry.chunk());
            vectors.add(embedding.clone());
        }
        if (chunks.isEmpty()) {
            throw new EmptyInputException("Cannot build an index without any embeddings");
        }
        if (dimension == 0) {
            throw new ConfigurationException("Embeddings must have at least one dimension");
        }
        return new ExactVectorIndex(metric, dimension, version, List.copyOf(chunks),
                vectors.toArray(new float[0][]));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public DistanceMetric metric() {
        return metric;
    }

    @Override
    public int size() {
        return chunks.size();
    }

    @Override
    public String corpusVersion() {
        return corpusVersion;
    }

    @Override
    public RetrievalResult search(float[] query, int k) {
        checkQuery(query, k);
        return scan(query, k, null);
    }

    @Override
    public List<IndexEntry> entries() {
        List<IndexEntry> entries = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            entries.add(new IndexEntry(chunks.get(i), vectors[i].clone()));
        }
        return Collections.unmodifiableList(entries);
    }

    void checkQuery(float[] query, int k) {
        Objects.requireNonNull(query, "query");
        if (query.length != dimension) {
            throw new DimensionMismatchException(dimension, query.length);
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1 but was " + k);
        }
    }

    float[] vector(int ordinal) {
        return vectors[ordinal];
    }

    /**
     * Scores the given ordinals, or all entries when {@code ordinals} is
     * {@code null}, and returns the best {@code k}. Ties are broken by
     * insertion order.
     */
    RetrievalResult scan(float[] query, int k, int[] ordinals) {
        double queryNorm = DistanceMetric.norm(query);
        PriorityQueue<Candidate> heap = new PriorityQueue<>(Math.min(k, vectors.length) + 1,
                BEST_FIRST.reversed());
        int count = ordinals == null ? vectors.length : ordinals.length;
        for (int i = 0; i < count; i++) {
            int ordinal = ordinals == null ? i : ordinals[i];
            double score = metric.score(query, queryNorm, vectors[ordinal], norms[ordinal]);
            heap.add(new Candidate(ordinal, score));
            if (heap.size() > k) {
                heap.poll();
            }
        }
        List<Candidate> best = new ArrayList<>(heap);
        best.sort(BEST_FIRST);
        return new RetrievalResult(best.stream()
                .map(candidate -> new ScoredChunk(chunks.get(candidate.ordinal()), candidate.score()))
                .toList());
    }

    private record Candidate(int ordinal, double score) {
    }
}
