package com.creditrust.rag.embedding;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link EmbeddingClient} backed by the OpenAI embeddings endpoint. The
 * requested dimension is passed along so that models supporting shortened
 * embeddings return vectors matching the index.
 */
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);

    private final RestClient restClient;
    private final String model;
    private final int dimension;

    public OpenAiEmbeddingClient(RestClient restClient, String model, int dimension) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        LOGGER.debug("Requesting {} embeddings from model {}", texts.size(), model);
        EmbeddingResponse response = restClient.post()
                .uri("/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("model", model, "input", texts, "dimensions", dimension))
                .retrieve()
                .body(EmbeddingResponse.class);
        if (response == null || response.data() == null) {
            throw new IllegalStateException("Empty embeddings response from model " + model);
        }
        return response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(EmbeddingData::embedding)
                .toList();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelId() {
        return model;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
