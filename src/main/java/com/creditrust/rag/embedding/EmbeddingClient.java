package com.creditrust.rag.embedding;

import java.util.List;

/**
 * Capability boundary mapping text to a fixed-dimension vector.
 * Implementations can either call a remote embedding API or provide
 * deterministic vectors suited for tests and local development.
 */
public interface EmbeddingClient {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array of {@link #dimension()} entries
     */
    float[] embed(String text);

    /**
     * Embed several texts at once. Remote implementations override this to
     * issue a single batched request.
     */
    default List<float[]> embedAll(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    int dimension();

    /**
     * Identifier of the underlying model, part of the corpus version tag.
     */
    String modelId();
}
