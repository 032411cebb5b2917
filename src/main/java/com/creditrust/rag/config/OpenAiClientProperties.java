package com.creditrust.rag.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.creditrust.rag.error.ConfigurationException;

/**
 * Simple configuration properties describing how to connect to OpenAI.
 */
@ConfigurationProperties(prefix = "rag.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests against the OpenAI service. Falls back
     * to the {@code OPENAI_API_KEY} environment variable.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Name of the chat model used for answer generation.
     */
    private String chatModel = "gpt-4o-mini";

    /**
     * Name of the embedding model. It must support the configured
     * {@code rag.embedding.dimension}.
     */
    private String embeddingModel = "text-embedding-3-small";

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("OPENAI_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getChatModel() {
        return chatModel;
    }

    public void setChatModel(String chatModel) {
        this.chatModel = chatModel;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    /**
     * Creates a client for the configured endpoint whose requests give up
     * after {@code timeout}.
     */
    public RestClient createRestClient(Duration timeout) {
        if (!StringUtils.hasText(getApiKey())) {
            throw new ConfigurationException(
                    "Property 'rag.openai.api-key' or OPENAI_API_KEY must be provided when mocks are disabled");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + getApiKey())
                .build();
    }
}
