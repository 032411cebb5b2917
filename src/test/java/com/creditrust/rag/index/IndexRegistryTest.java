package com.creditrust.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.creditrust.rag.error.IndexCorruptionException;
import com.creditrust.rag.error.IndexNotReadyException;

class IndexRegistryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");

    private final IndexRegistry registry = new IndexRegistry(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void refusesQueriesBeforeAnythingIsPublished() {
        assertThat(registry.status()).isEqualTo(IndexRegistry.Status.EMPTY);
        assertThatThrownBy(registry::current).isInstanceOf(IndexNotReadyException.class);
    }

    @Test
    void publishesSnapshotsWithIncreasingVersions() {
        IndexSnapshot first = registry.publish(index("a"));
        IndexSnapshot second = registry.publish(index("b"));

        assertThat(second.version()).isGreaterThan(first.version());
        assertThat(second.publishedAt()).isEqualTo(NOW);
        assertThat(registry.current()).isSameAs(second);
    }

    @Test
    void readersKeepTheSnapshotTheyAcquired() {
        registry.publish(index("old"));
        IndexSnapshot acquired = registry.current();

        registry.publish(index("new"));

        assertThat(acquired.index().search(new float[] { 1.0f, 0.0f }, 1).chunks().get(0).chunk().documentId())
                .isEqualTo("old");
        assertThat(registry.current().index().entries().get(0).chunk().documentId()).isEqualTo("new");
    }

    @Test
    void corruptedStateRefusesQueriesUntilNextPublish() {
        registry.publish(index("a"));
        registry.markCorrupted("checksum mismatch");

        assertThatThrownBy(registry::current)
                .isInstanceOf(IndexCorruptionException.class)
                .hasMessageContaining("checksum mismatch");
        assertThat(registry.describe().problem()).isEqualTo("checksum mismatch");

        registry.publish(index("b"));
        assertThat(registry.status()).isEqualTo(IndexRegistry.Status.READY);
    }

    @Test
    void teardownReturnsToEmpty() {
        registry.publish(index("a"));
        registry.teardown();

        assertThatThrownBy(registry::current).isInstanceOf(IndexNotReadyException.class);
    }

    @Test
    void describesThePublishedIndex() {
        registry.publish(index("a"));

        IndexStatus status = registry.describe();

        assertThat(status.state()).isEqualTo(IndexRegistry.Status.READY);
        assertThat(status.size()).isEqualTo(1);
        assertThat(status.dimension()).isEqualTo(2);
        assertThat(status.metric()).isEqualTo(DistanceMetric.COSINE);
        assertThat(status.corpusVersion()).isEqualTo("test-version");
        assertThat(status.approximate()).isFalse();
        assertThat(status.publishedAt()).isEqualTo(NOW);
    }

    private static ExactVectorIndex index(String documentId) {
        return ExactVectorIndex.build(List.of(ExactVectorIndexTest.entry(documentId, 1.0f, 0.0f)),
                DistanceMetric.COSINE);
    }
}
