package com.creditrust.rag.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.creditrust.rag.chat.AnswerService;
import com.creditrust.rag.chat.DefaultSseEmitterFactory;
import com.creditrust.rag.chat.GenerationClient;
import com.creditrust.rag.chat.MockGenerationClient;
import com.creditrust.rag.chat.OpenAiGenerationClient;
import com.creditrust.rag.chat.PromptAssembler;
import com.creditrust.rag.chat.QuestionAnsweringService;
import com.creditrust.rag.chat.SseEmitterFactory;
import com.creditrust.rag.embedding.EmbeddingClient;
import com.creditrust.rag.embedding.HashingEmbeddingClient;
import com.creditrust.rag.embedding.OpenAiEmbeddingClient;
import com.creditrust.rag.embedding.ResilientEmbeddingClient;
import com.creditrust.rag.error.DimensionMismatchException;
import com.creditrust.rag.eval.AnswerClassifier;
import com.creditrust.rag.eval.Evaluator;
import com.creditrust.rag.index.ApproximateIndexFactory;
import com.creditrust.rag.index.IndexBootstrap;
import com.creditrust.rag.index.IndexBuilder;
import com.creditrust.rag.index.IndexRegistry;
import com.creditrust.rag.index.VectorIndexFile;
import com.creditrust.rag.ingest.Chunker;
import com.creditrust.rag.ingest.JsonLinesDocumentSource;
import com.creditrust.rag.retrieval.Retriever;
import com.creditrust.rag.retry.CapabilityRetry;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the pipeline together. {@code rag.mock-openai}
 * decides whether deterministic local capabilities or the OpenAI API are used.
 */
@Configuration
@EnableConfigurationProperties({ RagProperties.class, OpenAiClientProperties.class })
public class RagConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "chatExecutor")
    public ExecutorService chatExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "indexBuildExecutor")
    public ExecutorService indexBuildExecutor(RagProperties properties) {
        return Executors.newFixedThreadPool(properties.getIndex().getConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "evaluationExecutor")
    public ExecutorService evaluationExecutor(RagProperties properties) {
        return Executors.newFixedThreadPool(properties.getEvaluation().getConcurrency());
    }

    @Bean
    @ConditionalOnMissingBean
    public SseEmitterFactory sseEmitterFactory() {
        return new DefaultSseEmitterFactory();
    }

    @Bean
    public CapabilityRetry capabilityRetry(RagProperties properties) {
        RagProperties.Capability capability = properties.getCapability();
        return new CapabilityRetry(capability.getMaxAttempts(), capability.getInitialBackoff(),
                capability.getBackoffMultiplier());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingClient hashingEmbeddingClient(RagProperties properties, CapabilityRetry capabilityRetry) {
        return checked(new ResilientEmbeddingClient(
                new HashingEmbeddingClient(properties.getEmbedding().getDimension()), capabilityRetry), properties);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public EmbeddingClient openAiEmbeddingClient(RagProperties properties, OpenAiClientProperties openAi,
            CapabilityRetry capabilityRetry) {
        OpenAiEmbeddingClient client = new OpenAiEmbeddingClient(
                openAi.createRestClient(properties.getGeneration().getTimeout()), openAi.getEmbeddingModel(),
                properties.getEmbedding().getDimension());
        return checked(new ResilientEmbeddingClient(client, capabilityRetry), properties);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public GenerationClient mockGenerationClient(RagProperties properties,
            @Qualifier("chatExecutor") ExecutorService chatExecutor) {
        return new MockGenerationClient(chatExecutor, properties.getGeneration().getTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public GenerationClient openAiGenerationClient(RagProperties properties, OpenAiClientProperties openAi,
            ObjectMapper objectMapper, @Qualifier("chatExecutor") ExecutorService chatExecutor) {
        return new OpenAiGenerationClient(openAi.createRestClient(properties.getGeneration().getTimeout()),
                objectMapper, openAi.getChatModel(), chatExecutor, properties.getGeneration().getTimeout());
    }

    @Bean
    public Chunker chunker(RagProperties properties, EmbeddingClient embeddingClient) {
        RagProperties.Chunking chunking = properties.getChunking();
        return new Chunker(chunking.getSize(), chunking.getOverlap(), chunking.getMinSize(),
                properties.corpusVersion(embeddingClient.modelId()));
    }

    @Bean
    public IndexRegistry indexRegistry() {
        return new IndexRegistry();
    }

    @Bean
    public VectorIndexFile vectorIndexFile(ObjectMapper objectMapper) {
        return new VectorIndexFile(objectMapper);
    }

    @Bean
    public IndexBuilder indexBuilder(RagProperties properties, Chunker chunker, EmbeddingClient embeddingClient,
            IndexRegistry indexRegistry, @Qualifier("indexBuildExecutor") ExecutorService indexBuildExecutor,
            VectorIndexFile vectorIndexFile, ObjectMapper objectMapper) {
        RagProperties.Index index = properties.getIndex();
        RagProperties.Approximate approximate = index.getApproximate();
        JsonLinesDocumentSource documentSource = index.getCorpusPath() == null ? null
                : new JsonLinesDocumentSource(index.getCorpusPath(), objectMapper);
        return new IndexBuilder(chunker, embeddingClient, indexRegistry, indexBuildExecutor, index.getMetric(),
                index.getBatchSize(), vectorIndexFile, index.getPath(),
                new ApproximateIndexFactory(approximate.isEnabled(), approximate.getClusters(),
                        approximate.getProbes(), approximate.getMinRecall()),
                documentSource);
    }

    @Bean
    public IndexBootstrap indexBootstrap(RagProperties properties, IndexBuilder indexBuilder,
            IndexRegistry indexRegistry, VectorIndexFile vectorIndexFile) {
        RagProperties.Index index = properties.getIndex();
        return new IndexBootstrap(indexBuilder, indexRegistry, vectorIndexFile, index.getPath(),
                properties.getEmbedding().getDimension(), index.getMetric(), index.isBuildOnStartup(),
                index.isRebuildOnCorruption());
    }

    @Bean
    public Retriever retriever(RagProperties properties, EmbeddingClient embeddingClient,
            IndexRegistry indexRegistry) {
        RagProperties.Retrieval retrieval = properties.getRetrieval();
        return new Retriever(embeddingClient, indexRegistry, retrieval.getMinSimilarity(),
                retrieval.getOverFetchFactor(), retrieval.getDedupOverlapThreshold(), retrieval.getContextUnit());
    }

    @Bean
    public PromptAssembler promptAssembler() {
        return new PromptAssembler();
    }

    @Bean
    public AnswerService answerService(RagProperties properties, GenerationClient generationClient,
            CapabilityRetry capabilityRetry) {
        RagProperties.Generation generation = properties.getGeneration();
        return new AnswerService(generationClient, capabilityRetry, generation.getEmptyContextPolicy(),
                generation.getUnattributedPolicy(), generation.getMinAttribution(),
                properties.getRetrieval().getSnippetLength());
    }

    @Bean
    public QuestionAnsweringService questionAnsweringService(RagProperties properties, Retriever retriever,
            PromptAssembler promptAssembler, AnswerService answerService,
            @Qualifier("chatExecutor") ExecutorService chatExecutor) {
        RagProperties.Retrieval retrieval = properties.getRetrieval();
        return new QuestionAnsweringService(retriever, promptAssembler, answerService, chatExecutor,
                retrieval.getTopK(), retrieval.getMaxContextSize());
    }

    @Bean
    public Evaluator evaluator(QuestionAnsweringService questionAnsweringService,
            @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
        return new Evaluator(questionAnsweringService, new AnswerClassifier(), evaluationExecutor);
    }

    private static EmbeddingClient checked(EmbeddingClient client, RagProperties properties) {
        if (client.dimension() != properties.getEmbedding().getDimension()) {
            throw new DimensionMismatchException(properties.getEmbedding().getDimension(), client.dimension());
        }
        return client;
    }
}
