package com.creditrust.rag.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import com.creditrust.rag.chat.EmptyContextPolicy;
import com.creditrust.rag.chat.UnattributedPolicy;
import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.index.DistanceMetric;
import com.creditrust.rag.retrieval.ContextUnit;

/**
 * Tuning knobs of the complaint question answering pipeline. The values are
 * checked once they are bound; an invalid combination aborts startup.
 */
@ConfigurationProperties(prefix = "rag")
public class RagProperties implements InitializingBean {

    /**
     * Use deterministic local capabilities instead of the OpenAI API.
     */
    private boolean mockOpenai = true;

    private final Chunking chunking = new Chunking();

    private final Embedding embedding = new Embedding();

    private final Index index = new Index();

    private final Retrieval retrieval = new Retrieval();

    private final Generation generation = new Generation();

    private final Capability capability = new Capability();

    private final Evaluation evaluation = new Evaluation();

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Index getIndex() {
        return index;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Capability getCapability() {
        return capability;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        if (chunking.overlap < 0) {
            throw new ConfigurationException("rag.chunking.overlap must not be negative but was " + chunking.overlap);
        }
        if (chunking.size <= chunking.overlap) {
            throw new ConfigurationException("rag.chunking.size (" + chunking.size
                    + ") must be greater than rag.chunking.overlap (" + chunking.overlap + ")");
        }
        requireAtLeast("rag.chunking.min-size", chunking.minSize, 1);
        requireAtLeast("rag.embedding.dimension", embedding.dimension, 1);
        requireAtLeast("rag.index.concurrency", index.concurrency, 1);
        requireAtLeast("rag.index.batch-size", index.batchSize, 1);
        requireAtLeast("rag.index.approximate.probes", index.approximate.probes, 1);
        requireFraction("rag.index.approximate.min-recall", index.approximate.minRecall);
        requireAtLeast("rag.retrieval.top-k", retrieval.topK, 1);
        requireAtLeast("rag.retrieval.max-context-size", retrieval.maxContextSize, 1);
        requireAtLeast("rag.retrieval.over-fetch-factor", retrieval.overFetchFactor, 1);
        requireAtLeast("rag.retrieval.snippet-length", retrieval.snippetLength, 1);
        requireFraction("rag.retrieval.dedup-overlap-threshold", retrieval.dedupOverlapThreshold);
        if (retrieval.contextUnit == ContextUnit.CHARACTERS && retrieval.maxContextSize < chunking.size) {
            throw new ConfigurationException("rag.retrieval.max-context-size (" + retrieval.maxContextSize
                    + ") must hold at least one chunk of rag.chunking.size (" + chunking.size + ") characters");
        }
        if (generation.timeout == null || generation.timeout.isNegative() || generation.timeout.isZero()) {
            throw new ConfigurationException("rag.generation.timeout must be positive but was " + generation.timeout);
        }
        requireFraction("rag.generation.min-attribution", generation.minAttribution);
        requireAtLeast("rag.capability.max-attempts", capability.maxAttempts, 1);
        if (capability.initialBackoff == null || capability.initialBackoff.toMillis() < 1) {
            throw new ConfigurationException(
                    "rag.capability.initial-backoff must be at least 1ms but was " + capability.initialBackoff);
        }
        if (capability.backoffMultiplier < 1.0d) {
            throw new ConfigurationException(
                    "rag.capability.backoff-multiplier must be >= 1 but was " + capability.backoffMultiplier);
        }
        requireAtLeast("rag.evaluation.concurrency", evaluation.concurrency, 1);
    }

    /**
     * Version tag shared by every chunk built under the current chunking and
     * embedding settings.
     *
     * @param modelId id reported by the embedding client, used unless
     *                {@code rag.embedding.model} is set
     */
    public String corpusVersion(String modelId) {
        String model = embedding.model == null || embedding.model.isBlank() ? modelId : embedding.model;
        return "chunks-" + chunking.size + "-" + chunking.overlap + "-" + chunking.minSize + "/" + model + "/"
                + embedding.dimension;
    }

    private static void requireAtLeast(String property, int value, int minimum) {
        if (value < minimum) {
            throw new ConfigurationException(property + " must be at least " + minimum + " but was " + value);
        }
    }

    private static void requireFraction(String property, double value) {
        if (value < 0.0d || value > 1.0d) {
            throw new ConfigurationException(property + " must be within [0, 1] but was " + value);
        }
    }

    public static class Chunking {

        /**
         * Maximum chunk length in characters.
         */
        private int size = 1500;

        private int overlap = 150;

        /**
         * Documents whose trimmed text is shorter than this are skipped.
         */
        private int minSize = 20;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public int getMinSize() {
            return minSize;
        }

        public void setMinSize(int minSize) {
            this.minSize = minSize;
        }
    }

    public static class Embedding {

        private int dimension = 384;

        /**
         * Model label recorded in the corpus version. Defaults to the id of
         * the configured embedding client.
         */
        private String model;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    public static class Index {

        private DistanceMetric metric = DistanceMetric.COSINE;

        private Path path = Path.of("vector_store", "complaint_index");

        /**
         * JSON-lines corpus the index is built from. Without it the index can
         * only be loaded.
         */
        private Path corpusPath;

        private boolean buildOnStartup = true;

        private boolean rebuildOnCorruption = false;

        private int concurrency = 4;

        private int batchSize = 64;

        private final Approximate approximate = new Approximate();

        public DistanceMetric getMetric() {
            return metric;
        }

        public void setMetric(DistanceMetric metric) {
            this.metric = metric;
        }

        public Path getPath() {
            return path;
        }

        public void setPath(Path path) {
            this.path = path;
        }

        public Path getCorpusPath() {
            return corpusPath;
        }

        public void setCorpusPath(Path corpusPath) {
            this.corpusPath = corpusPath;
        }

        public boolean isBuildOnStartup() {
            return buildOnStartup;
        }

        public void setBuildOnStartup(boolean buildOnStartup) {
            this.buildOnStartup = buildOnStartup;
        }

        public boolean isRebuildOnCorruption() {
            return rebuildOnCorruption;
        }

        public void setRebuildOnCorruption(boolean rebuildOnCorruption) {
            this.rebuildOnCorruption = rebuildOnCorruption;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Approximate getApproximate() {
            return approximate;
        }
    }

    public static class Approximate {

        private boolean enabled = false;

        /**
         * Number of k-means clusters, {@code 0} for the square root of the
         * index size.
         */
        private int clusters = 0;

        private int probes = 4;

        private double minRecall = 0.9d;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getClusters() {
            return clusters;
        }

        public void setClusters(int clusters) {
            this.clusters = clusters;
        }

        public int getProbes() {
            return probes;
        }

        public void setProbes(int probes) {
            this.probes = probes;
        }

        public double getMinRecall() {
            return minRecall;
        }

        public void setMinRecall(double minRecall) {
            this.minRecall = minRecall;
        }
    }

    public static class Retrieval {

        private int topK = 5;

        private int maxContextSize = 6000;

        private ContextUnit contextUnit = ContextUnit.CHARACTERS;

        /**
         * Candidates scoring below this are treated as irrelevant.
         */
        private double minSimilarity = 0.3d;

        private int overFetchFactor = 3;

        private double dedupOverlapThreshold = 0.5d;

        private int snippetLength = 200;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getMaxContextSize() {
            return maxContextSize;
        }

        public void setMaxContextSize(int maxContextSize) {
            this.maxContextSize = maxContextSize;
        }

        public ContextUnit getContextUnit() {
            return contextUnit;
        }

        public void setContextUnit(ContextUnit contextUnit) {
            this.contextUnit = contextUnit;
        }

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public int getOverFetchFactor() {
            return overFetchFactor;
        }

        public void setOverFetchFactor(int overFetchFactor) {
            this.overFetchFactor = overFetchFactor;
        }

        public double getDedupOverlapThreshold() {
            return dedupOverlapThreshold;
        }

        public void setDedupOverlapThreshold(double dedupOverlapThreshold) {
            this.dedupOverlapThreshold = dedupOverlapThreshold;
        }

        public int getSnippetLength() {
            return snippetLength;
        }

        public void setSnippetLength(int snippetLength) {
            this.snippetLength = snippetLength;
        }
    }

    public static class Generation {

        /**
         * Longest wait for the next answer increment; also the HTTP timeout of
         * the OpenAI clients.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private EmptyContextPolicy emptyContextPolicy = EmptyContextPolicy.SHORT_CIRCUIT;

        private UnattributedPolicy unattributedPolicy = UnattributedPolicy.FLAG;

        private double minAttribution = 0.5d;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public EmptyContextPolicy getEmptyContextPolicy() {
            return emptyContextPolicy;
        }

        public void setEmptyContextPolicy(EmptyContextPolicy emptyContextPolicy) {
            this.emptyContextPolicy = emptyContextPolicy;
        }

        public UnattributedPolicy getUnattributedPolicy() {
            return unattributedPolicy;
        }

        public void setUnattributedPolicy(UnattributedPolicy unattributedPolicy) {
            this.unattributedPolicy = unattributedPolicy;
        }

        public double getMinAttribution() {
            return minAttribution;
        }

        public void setMinAttribution(double minAttribution) {
            this.minAttribution = minAttribution;
        }
    }

    public static class Capability {

        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(500);

        private double backoffMultiplier = 2.0d;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Evaluation {

        private int concurrency = 4;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }
}
