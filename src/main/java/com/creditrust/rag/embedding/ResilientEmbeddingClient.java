package com.creditrust.rag.embedding;

import java.util.List;
import java.util.Objects;

import com.creditrust.rag.error.DimensionMismatchException;
import com.creditrust.rag.error.EmbeddingUnavailableException;
import com.creditrust.rag.retry.CapabilityRetry;

/**
 * Decorates an {@link EmbeddingClient} with retries and verifies that every
 * returned vector has the dimension the client advertises.
 */
public class ResilientEmbeddingClient implements EmbeddingClient {

    private final EmbeddingClient delegate;
    private final CapabilityRetry retry;

    public ResilientEmbeddingClient(EmbeddingClient delegate, CapabilityRetry retry) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    @Override
    public float[] embed(String text) {
        float[] vector = retry.execute("embedding", () -> delegate.embed(text), EmbeddingUnavailableException::new);
        return checked(vector);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = retry.execute("embedding", () -> delegate.embedAll(texts),
                EmbeddingUnavailableException::new);
        if (vectors.size() != texts.size()) {
            throw new EmbeddingUnavailableException(
                    "Embedding count mismatch: " + texts.size() + " inputs, " + vectors.size() + " vectors", null);
        }
        vectors.forEach(this::checked);
        return vectors;
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    private float[] checked(float[] vector) {
        if (vector.length != delegate.dimension()) {
            throw new DimensionMismatchException(delegate.dimension(), vector.length);
        }
        return vector;
    }
}
