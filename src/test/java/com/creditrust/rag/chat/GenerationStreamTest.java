package com.creditrust.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.creditrust.rag.error.GenerationUnavailableException;

class GenerationStreamTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void deliversIncrementsInOrderAndCompletes() {
        GenerationStream stream = GenerationStream.produce(executor, Duration.ofSeconds(5), sink -> {
            sink.emit("Late ");
            sink.emit("fees ");
            sink.emit("apply.");
        });

        List<String> increments = new ArrayList<>();
        stream.forEachRemaining(increments::add);

        assertThat(increments).containsExactly("Late ", "fees ", "apply.");
        assertThat(stream.isCompleted()).isTrue();
        assertThat(stream.isCancelled()).isFalse();
    }

    @Test
    void failsWhenNoIncrementArrivesInTime() {
        CountDownLatch release = new CountDownLatch(1);
        GenerationStream stream = GenerationStream.produce(executor, Duration.ofMillis(50), sink -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });

        assertThatThrownBy(stream::hasNext)
                .isInstanceOf(GenerationUnavailableException.class)
                .hasMessageContaining("within");
        assertThat(stream.isCancelled()).isTrue();
        release.countDown();
    }

    @Test
    void cancellingStopsTheProducerAndRunsHooks() throws InterruptedException {
        AtomicBoolean hookRan = new AtomicBoolean();
        AtomicInteger emitted = new AtomicInteger();
        CountDownLatch firstEmitted = new CountDownLatch(1);
        CountDownLatch producerDone = new CountDownLatch(1);
        GenerationStream stream = GenerationStream.produce(executor, Duration.ofSeconds(5), sink -> {
            sink.onCancel(() -> hookRan.set(true));
            while (sink.emit("word ")) {
                emitted.incrementAndGet();
                firstEmitted.countDown();
                try {
                    Thread.sleep(5);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            producerDone.countDown();
        });

        assertThat(firstEmitted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(stream.next()).isEqualTo("word ");
        stream.cancel();

        assertThat(stream.hasNext()).isFalse();
        assertThat(stream.isCancelled()).isTrue();
        assertThat(stream.isCompleted()).isFalse();
        assertThat(hookRan).isTrue();
        assertThat(producerDone.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void wrapsProducerFailures() {
        GenerationStream stream = GenerationStream.produce(executor, Duration.ofSeconds(5), sink -> {
            sink.emit("partial");
            throw new IllegalStateException("connection reset");
        });

        assertThat(stream.next()).isEqualTo("partial");
        assertThatThrownBy(stream::hasNext)
                .isInstanceOf(GenerationUnavailableException.class)
                .hasRootCauseMessage("connection reset");
    }

    @Test
    void fixedStreamsAreCompletedUpFront() {
        GenerationStream stream = GenerationStream.of(List.of("a", "", "b"));

        List<String> increments = new ArrayList<>();
        stream.forEachRemaining(increments::add);

        assertThat(increments).containsExactly("a", "b");
    }
}
