package com.creditrust.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import com.creditrust.rag.error.DimensionMismatchException;
import com.creditrust.rag.error.EmbeddingUnavailableException;
import com.creditrust.rag.retry.CapabilityRetry;

class ResilientEmbeddingClientTest {

    private final EmbeddingClient delegate = mock(EmbeddingClient.class);
    private final ResilientEmbeddingClient client = new ResilientEmbeddingClient(delegate,
            new CapabilityRetry(3, Duration.ofMillis(1), 1.0d));

    @Test
    void retriesTransientFailures() {
        when(delegate.dimension()).thenReturn(2);
        when(delegate.embed("fee"))
                .thenThrow(new ResourceAccessException("connection reset"))
                .thenReturn(new float[] { 1.0f, 0.0f });

        assertThat(client.embed("fee")).containsExactly(1.0f, 0.0f);
        verify(delegate, times(2)).embed("fee");
    }

    @Test
    void reportsUnavailableOnceRetriesAreExhausted() {
        when(delegate.embed("fee")).thenThrow(new ResourceAccessException("connection refused"));

        assertThatThrownBy(() -> client.embed("fee"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasCauseInstanceOf(ResourceAccessException.class);
        verify(delegate, times(3)).embed("fee");
    }

    @Test
    void rejectsVectorsOfTheWrongDimension() {
        when(delegate.dimension()).thenReturn(384);
        when(delegate.embed("fee")).thenReturn(new float[256]);

        assertThatThrownBy(() -> client.embed("fee")).isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void rejectsMissingVectorsInABatch() {
        when(delegate.dimension()).thenReturn(2);
        when(delegate.embedAll(List.of("a", "b"))).thenReturn(List.of(new float[2]));

        assertThatThrownBy(() -> client.embedAll(List.of("a", "b")))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("2 inputs, 1 vectors");
    }
}
