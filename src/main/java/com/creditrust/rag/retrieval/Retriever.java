package com.creditrust.rag.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.embedding.EmbeddingClient;
import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.index.IndexRegistry;
import com.creditrust.rag.index.IndexSnapshot;
import com.creditrust.rag.index.RetrievalResult;
import com.creditrust.rag.index.ScoredChunk;
import com.creditrust.rag.ingest.Chunk;

/**
 * Finds the chunks relevant to a question. Candidates are over-fetched from the
 * current index snapshot, filtered by a minimum similarity, de-duplicated on
 * overlapping spans of the same complaint and finally cut to fit the context
 * budget. An empty result means nothing was relevant enough and is not an
 * error.
 */
public class Retriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(Retriever.class);

    private final EmbeddingClient embeddingClient;
    private final IndexRegistry registry;
    private final double minSimilarity;
    private final int overFetchFactor;
    private final double dedupOverlapThreshold;
    private final ContextUnit contextUnit;

    public Retriever(EmbeddingClient embeddingClient, IndexRegistry registry, double minSimilarity,
            int overFetchFactor, double dedupOverlapThreshold, ContextUnit contextUnit) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.contextUnit = Objects.requireNonNull(contextUnit, "contextUnit");
        if (overFetchFactor < 1) {
            throw new ConfigurationException("Over-fetch factor must be at least 1 but was " + overFetchFactor);
        }
        if (dedupOverlapThreshold < 0.0d || dedupOverlapThreshold > 1.0d) {
            throw new ConfigurationException(
                    "Dedup overlap threshold must be within [0, 1] but was " + dedupOverlapThreshold);
        }
        this.minSimilarity = minSimilarity;
        this.overFetchFactor = overFetchFactor;
        this.dedupOverlapThreshold = dedupOverlapThreshold;
    }

    public RetrievalResult retrieve(String query, int k, int maxContextSize) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1 but was " + k);
        }
        if (maxContextSize < 1) {
            throw new IllegalArgumentException("Context size must be at least 1 but was " + maxContextSize);
        }
        float[] embedding = embeddingClient.embed(query);
        IndexSnapshot snapshot = registry.current();
        RetrievalResult raw = snapshot.index().search(embedding, overFetch(k));

        List<ScoredChunk> relevant = raw.chunks().stream()
                .filter(candidate -> candidate.score() >= minSimilarity)
                .toList();
        if (relevant.isEmpty()) {
            LOGGER.debug("No candidate reached similarity {} (best of {} was {})", minSimilarity, raw.size(),
                    raw.isEmpty() ? "n/a" : raw.chunks().get(0).score());
            return RetrievalResult.empty();
        }

        List<ScoredChunk> distinct = new ArrayList<>();
        for (ScoredChunk candidate : relevant) {
            if (distinct.size() == k) {
                break;
            }
            if (distinct.stream().noneMatch(kept -> duplicates(kept.chunk(), candidate.chunk()))) {
                distinct.add(candidate);
            }
        }

        List<ScoredChunk> fitted = new ArrayList<>();
        int used = 0;
        for (ScoredChunk candidate : distinct) {
            int cost = contextUnit.measure(candidate.chunk().text());
            if (used + cost > maxContextSize) {
                break;
            }
            used += cost;
            fitted.add(candidate);
        }
        LOGGER.debug("Snapshot {}: {} raw, {} relevant, {} distinct, {} within {} {}", snapshot.version(),
                raw.size(), relevant.size(), distinct.size(), fitted.size(), maxContextSize, contextUnit);
        return new RetrievalResult(fitted);
    }

    /**
     * Number of candidates requested from the index, saturating instead of
     * overflowing for very large {@code k}.
     */
    int overFetch(int k) {
        long candidates = (long) k * overFetchFactor;
        return (int) Math.min(candidates, Integer.MAX_VALUE);
    }

    boolean duplicates(Chunk first, Chunk second) {
        if (!first.documentId().equals(second.documentId())) {
            return false;
        }
        int shorter = Math.min(first.span().length(), second.span().length());
        if (shorter == 0) {
            return false;
        }
        return (double) first.span().overlap(second.span()) / shorter > dedupOverlapThreshold;
    }
}
