package com.creditrust.rag.index;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.embedding.EmbeddingClient;
import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.error.DataException;
import com.creditrust.rag.error.EmptyInputException;
import com.creditrust.rag.error.IndexBuildInProgressException;
import com.creditrust.rag.ingest.Chunk;
import com.creditrust.rag.ingest.Chunker;
import com.creditrust.rag.ingest.Document;
import com.creditrust.rag.ingest.DocumentSource;

/**
 * Turns documents into a published index: chunk, embed in batches on the
 * build executor, assemble the exact index, persist it and publish it to the
 * {@link IndexRegistry}. Only one build runs at a time; a second request while
 * a build is running is rejected instead of queued.
 */
public class IndexBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexBuilder.class);

    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;
    private final IndexRegistry registry;
    private final Executor executor;
    private final DistanceMetric metric;
    private final int batchSize;
    private final VectorIndexFile indexFile;
    private final Path indexPath;
    private final ApproximateIndexFactory approximateIndexFactory;
    private final DocumentSource documentSource;
    private final ReentrantLock buildLock = new ReentrantLock();

    /**
     * @param indexFile      persistence, may be {@code null} together with
     *                       {@code indexPath} to keep the index in memory only
     * @param documentSource configured corpus, may be {@code null}
     */
    public IndexBuilder(Chunker chunker, EmbeddingClient embeddingClient, IndexRegistry registry, Executor executor,
            DistanceMetric metric, int batchSize, VectorIndexFile indexFile, Path indexPath,
            ApproximateIndexFactory approximateIndexFactory, DocumentSource documentSource) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metric = Objects.requireNonNull(metric, "metric");
        if (batchSize < 1) {
            throw new ConfigurationException("Embedding batch size must be at least 1 but was " + batchSize);
        }
        this.batchSize = batchSize;
        this.indexFile = indexFile;
        this.indexPath = indexPath;
        this.approximateIndexFactory = Objects.requireNonNull(approximateIndexFactory, "approximateIndexFactory");
        this.documentSource = documentSource;
    }

    public boolean hasDocumentSource() {
        return documentSource != null;
    }

    public String corpusVersion() {
        return chunker.version();
    }

    /**
     * Rebuild from the configured {@link DocumentSource}.
     */
    public IndexBuildReport rebuildFromSource() {
        if (documentSource == null) {
            throw new DataException("No corpus is configured, set rag.index.corpus-path to rebuild the index");
        }
        return withBuildLock(() -> buildAndPublish(documentSource.load()));
    }

    public IndexBuildReport rebuild(List<Document> documents) {
        Objects.requireNonNull(documents, "documents");
        return withBuildLock(() -> buildAndPublish(documents));
    }

    /**
     * Build an index without persisting or publishing it.
     */
    public ExactVectorIndex build(List<Document> documents) {
        return assemble(documents).index();
    }

    /**
     * Publish an index that was loaded from disk, applying the approximate
     * index policy.
     */
    public IndexSnapshot publishLoaded(ExactVectorIndex index) {
        return registry.publish(approximateIndexFactory.forServing(index));
    }

    private IndexBuildReport withBuildLock(BuildStep step) {
        if (!buildLock.tryLock()) {
            throw new IndexBuildInProgressException();
        }
        try {
            return step.run();
        } finally {
            buildLock.unlock();
        }
    }

    private IndexBuildReport buildAndPublish(List<Document> documents) {
        long started = System.nanoTime();
        Assembly assembly = assemble(documents);
        boolean persisted = false;
        if (indexFile != null && indexPath != null) {
            indexFile.persist(assembly.index(), indexPath);
            persisted = true;
        }
        VectorIndex serving = approximateIndexFactory.forServing(assembly.index());
        IndexSnapshot snapshot = registry.publish(serving);
        long durationMillis = (System.nanoTime() - started) / 1_000_000L;
        LOGGER.info("Index build finished in {} ms: {} documents ({} rejected), {} chunks", durationMillis,
                assembly.documents(), assembly.rejected(), assembly.index().size());
        return new IndexBuildReport(snapshot.version(), assembly.documents(), assembly.rejected(),
                assembly.index().size(), serving.dimension(), serving.metric(), serving.corpusVersion(),
                serving.approximate(), persisted, durationMillis);
    }

    private Assembly assemble(List<Document> documents) {
        Set<String> seen = new HashSet<>();
        List<Chunk> chunks = new ArrayList<>();
        int accepted = 0;
        int rejected = 0;
        for (Document document : documents) {
            try {
                if (document.text().isBlank()) {
                    throw new DataException("Document " + document.id() + " has no text");
                }
                if (!seen.add(document.id())) {
                    throw new DataException("Duplicate document id " + document.id());
                }
                int before = chunks.size();
                chunker.chunk(document).forEach(chunks::add);
                LOGGER.debug("Document {} produced {} chunks", document.id(), chunks.size() - before);
                accepted++;
            } catch (DataException ex) {
                rejected++;
                LOGGER.warn("Rejected document: {}", ex.getMessage());
            }
        }
        if (chunks.isEmpty()) {
            throw new EmptyInputException("No chunks could be produced from " + documents.size() + " documents ("
                    + rejected + " rejected)");
        }
        List<IndexEntry> entries = embed(chunks);
        return new Assembly(ExactVectorIndex.build(entries, metric), accepted, rejected);
    }

    private List<IndexEntry> embed(List<Chunk> chunks) {
        List<CompletableFuture<List<float[]>>> batches = new ArrayList<>();
        for (int from = 0; from < chunks.size(); from += batchSize) {
            List<String> texts = chunks.subList(from, Math.min(from + batchSize, chunks.size())).stream()
                    .map(Chunk::text)
                    .toList();
            batches.add(CompletableFuture.supplyAsync(() -> embeddingClient.embedAll(texts), executor));
        }
        LOGGER.info("Embedding {} chunks in {} batches", chunks.size(), batches.size());
        List<IndexEntry> entries = new ArrayList<>(chunks.size());
        int ordinal = 0;
        for (CompletableFuture<List<float[]>> batch : batches) {
            for (float[] vector : join(batch)) {
                entries.add(new IndexEntry(chunks.get(ordinal++), vector));
            }
        }
        return entries;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }

    @FunctionalInterface
    private interface BuildStep {

        IndexBuildReport run();
    }

    private record Assembly(ExactVectorIndex index, int documents, int rejected) {
    }
}
