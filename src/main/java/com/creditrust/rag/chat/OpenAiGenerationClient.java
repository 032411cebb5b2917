package com.creditrust.rag.chat;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Streams chat completions from the OpenAI API. The request is sent
 * synchronously so that connection and status failures reach the caller's
 * retry; the event stream is then read on the executor.
 */
public class OpenAiGenerationClient implements GenerationClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiGenerationClient.class);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Executor executor;
    private final Duration timeout;

    public OpenAiGenerationClient(RestClient restClient, ObjectMapper objectMapper, String model, Executor executor,
            Duration timeout) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.model = Objects.requireNonNull(model, "model");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public GenerationStream generate(Prompt prompt) {
        LOGGER.debug("Requesting streamed completion with model {} and {} sources", model, prompt.sources().size());
        Map<String, Object> body = Map.of(
                "model", model,
                "stream", true,
                "temperature", 0,
                "messages", List.of(
                        Map.of("role", "system", "content", prompt.instruction()),
                        Map.of("role", "user", "content",
                                "Context:\n" + prompt.context() + "\n\nQuestion: " + prompt.question())));
        ClientHttpResponse response = restClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(body)
                .exchange((request, clientResponse) -> clientResponse, false);
        checkStatus(response);
        return GenerationStream.produce(executor, timeout, sink -> {
            sink.onCancel(response::close);
            try (response; BufferedReader reader = new BufferedReader(
                    new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                String line;
                while (!sink.isCancelled() && (line = reader.readLine()) != null) {
                    if (!line.startsWith(DATA_PREFIX)) {
                        continue;
                    }
                    String data = line.substring(DATA_PREFIX.length()).strip();
                    if (DONE.equals(data)) {
                        return;
                    }
                    if (!sink.emit(delta(data))) {
                        return;
                    }
                }
            } catch (IOException ex) {
                if (!sink.isCancelled()) {
                    throw new UncheckedIOException("Reading the completion stream failed", ex);
                }
            }
        });
    }

    String delta(String data) throws IOException {
        JsonNode choices = objectMapper.readTree(data).path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return "";
        }
        return choices.get(0).path("delta").path("content").asText("");
    }

    private static void checkStatus(ClientHttpResponse response) {
        try {
            HttpStatusCode status = response.getStatusCode();
            if (!status.isError()) {
                return;
            }
            HttpHeaders headers = response.getHeaders();
            String statusText = response.getStatusText();
            byte[] body = response.getBody().readAllBytes();
            response.close();
            if (status.is4xxClientError()) {
                throw HttpClientErrorException.create(status, statusText, headers, body, StandardCharsets.UTF_8);
            }
            throw HttpServerErrorException.create(status, statusText, headers, body, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            response.close();
            throw new UncheckedIOException("Unable to read the completion response", ex);
        }
    }
}
