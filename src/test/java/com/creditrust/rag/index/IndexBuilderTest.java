package com.creditrust.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.creditrust.rag.ComplaintFixtures;
import com.creditrust.rag.embedding.EmbeddingClient;
import com.creditrust.rag.embedding.HashingEmbeddingClient;
import com.creditrust.rag.error.DataException;
import com.creditrust.rag.error.EmbeddingUnavailableException;
import com.creditrust.rag.error.EmptyInputException;
import com.creditrust.rag.error.IndexBuildInProgressException;
import com.creditrust.rag.ingest.Chunker;
import com.creditrust.rag.ingest.Document;
import com.creditrust.rag.ingest.DocumentSource;
import com.fasterxml.jackson.databind.ObjectMapper;

class IndexBuilderTest {

    private static final Executor DIRECT = Runnable::run;

    @TempDir
    Path tempDir;

    private final IndexRegistry registry = new IndexRegistry();
    private final EmbeddingClient embeddingClient = new HashingEmbeddingClient(64);

    @Test
    void buildsAndPublishesAnIndex() {
        IndexBuilder builder = builder(null, null, 2);

        IndexBuildReport report = builder.rebuild(ComplaintFixtures.threeComplaints());

        assertThat(report.documents()).isEqualTo(3);
        assertThat(report.rejectedDocuments()).isZero();
        assertThat(report.chunks()).isEqualTo(3);
        assertThat(report.dimension()).isEqualTo(64);
        assertThat(report.metric()).isEqualTo(DistanceMetric.COSINE);
        assertThat(report.corpusVersion()).isEqualTo("v1");
        assertThat(report.persisted()).isFalse();
        assertThat(registry.current().version()).isEqualTo(report.snapshotVersion());
        assertThat(registry.current().index().size()).isEqualTo(3);
    }

    @Test
    void rejectsBlankAndDuplicateDocumentsButKeepsTheRest() {
        List<Document> documents = new ArrayList<>(ComplaintFixtures.threeComplaints());
        documents.add(new Document("blank", null, "   "));
        documents.add(new Document(ComplaintFixtures.LATE_FEE, null, "A second complaint reusing the same id."));

        IndexBuildReport report = builder(null, null, 64).rebuild(documents);

        assertThat(report.documents()).isEqualTo(3);
        assertThat(report.rejectedDocuments()).isEqualTo(2);
    }

    @Test
    void failsWhenNothingCanBeIndexed() {
        IndexBuilder builder = builder(null, null, 64);

        assertThatThrownBy(() -> builder.rebuild(List.of())).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> builder.rebuild(List.of(new Document("blank", null, " "))))
                .isInstanceOf(EmptyInputException.class);
        assertThat(registry.status()).isEqualTo(IndexRegistry.Status.EMPTY);
    }

    @Test
    void rebuildingAnUnchangedCorpusYieldsEqualContents() {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            IndexBuilder builder = new IndexBuilder(new Chunker(60, 10, 1, "v1"), embeddingClient, registry, pool,
                    DistanceMetric.COSINE, 2, null, null, ApproximateIndexFactory.disabled(), null);

            List<IndexEntry> first = builder.build(ComplaintFixtures.threeComplaints()).entries();
            List<IndexEntry> second = builder.build(ComplaintFixtures.threeComplaints()).entries();

            assertThat(first).hasSizeGreaterThan(3).hasSameSizeAs(second);
            for (int i = 0; i < first.size(); i++) {
                assertThat(second.get(i).chunk()).isEqualTo(first.get(i).chunk());
                assertThat(second.get(i).embedding()).containsExactly(first.get(i).embedding());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void persistsTheIndexWhenAPathIsConfigured() {
        VectorIndexFile indexFile = new VectorIndexFile(new ObjectMapper());
        Path directory = tempDir.resolve("complaint_index");

        IndexBuildReport report = builder(indexFile, directory, 64).rebuild(ComplaintFixtures.threeComplaints());

        assertThat(report.persisted()).isTrue();
        assertThat(indexFile.load(directory, 64, DistanceMetric.COSINE).size()).isEqualTo(3);
    }

    @Test
    void propagatesEmbeddingFailures() {
        EmbeddingClient failing = new HashingEmbeddingClient(64) {
            @Override
            public List<float[]> embedAll(List<String> texts) {
                throw new EmbeddingUnavailableException("embedding service down", null);
            }
        };
        IndexBuilder builder = new IndexBuilder(new Chunker(1500, 150, 1, "v1"), failing, registry, DIRECT,
                DistanceMetric.COSINE, 64, null, null, ApproximateIndexFactory.disabled(), null);

        assertThatThrownBy(() -> builder.rebuild(ComplaintFixtures.threeComplaints()))
                .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void rejectsASecondBuildWhileOneIsRunning() throws Exception {
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DocumentSource slowSource = () -> {
            loading.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return ComplaintFixtures.threeComplaints();
        };
        IndexBuilder builder = new IndexBuilder(new Chunker(1500, 150, 1, "v1"), embeddingClient, registry, DIRECT,
                DistanceMetric.COSINE, 64, null, null, ApproximateIndexFactory.disabled(), slowSource);

        CompletableFuture<IndexBuildReport> running = CompletableFuture.supplyAsync(builder::rebuildFromSource);
        assertThat(loading.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> builder.rebuild(ComplaintFixtures.threeComplaints()))
                .isInstanceOf(IndexBuildInProgressException.class);

        release.countDown();
        assertThat(running.get(5, TimeUnit.SECONDS).chunks()).isEqualTo(3);
    }

    @Test
    void rebuildFromSourceRequiresACorpus() {
        assertThat(builder(null, null, 64).hasDocumentSource()).isFalse();
        assertThatThrownBy(() -> builder(null, null, 64).rebuildFromSource()).isInstanceOf(DataException.class);
    }

    private IndexBuilder builder(VectorIndexFile indexFile, Path path, int batchSize) {
        return new IndexBuilder(new Chunker(1500, 150, 1, "v1"), embeddingClient, registry, DIRECT,
                DistanceMetric.COSINE, batchSize, indexFile, path, ApproximateIndexFactory.disabled(), null);
    }
}
