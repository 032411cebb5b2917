package com.creditrust.rag.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.ingest.TextTokens;

/**
 * Deterministic embedding model that runs without external API calls. Every
 * normalised word token is hashed into one of {@code dimension} buckets and
 * the resulting term-frequency vector is L2-normalised, so the cosine
 * similarity of two texts reflects their shared vocabulary.
 */
public class HashingEmbeddingClient implements EmbeddingClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashingEmbeddingClient.class);

    private final int dimension;

    public HashingEmbeddingClient(int dimension) {
        if (dimension <= 0) {
            throw new ConfigurationException("Embedding dimension must be positive but was " + dimension);
        }
        this.dimension = dimension;
        LOGGER.info("Using hashed bag-of-words embeddings with {} dimensions", dimension);
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        for (String token : TextTokens.tokenize(text)) {
            vector[bucket(token)] += 1.0f;
        }
        double norm = 0.0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelId() {
        return "hashing-bow";
    }

    private int bucket(String token) {
        byte[] digest = sha256(token);
        long value = 0L;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (digest[i] & 0xFF);
        }
        return (int) Math.floorMod(value, (long) dimension);
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
