package com.creditrust.rag.chat;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.error.CapabilityException;
import com.creditrust.rag.error.GenerationUnavailableException;

/**
 * Lazy, cancellable sequence of generated text increments. A producer pushes
 * increments through a {@link Sink}; the consumer pulls them with the
 * {@link Iterator} methods and waits at most {@code timeout} for each one.
 * Cancelling stops consumption, drops anything buffered and runs the cancel
 * hooks registered by the producer.
 */
public final class GenerationStream implements Iterator<String>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationStream.class);

    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Duration timeout;
    private final Sink sink = new Sink();
    private String pending;
    private boolean finished;

    private GenerationStream(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Run {@code producer} on {@code executor}. The stream completes when the
     * producer returns and fails when it throws.
     */
    public static GenerationStream produce(Executor executor, Duration timeout, Producer producer) {
        GenerationStream stream = new GenerationStream(timeout);
        executor.execute(() -> {
            try {
                producer.produce(stream.sink);
                stream.sink.complete();
            } catch (RuntimeException ex) {
                stream.sink.fail(ex);
            }
        });
        return stream;
    }

    /**
     * Already completed stream over the given increments.
     */
    public static GenerationStream of(List<String> increments) {
        GenerationStream stream = new GenerationStream(Duration.ofSeconds(1));
        increments.forEach(stream.sink::emit);
        stream.sink.complete();
        return stream;
    }

    @Override
    public boolean hasNext() {
        if (cancelled.get()) {
            return false;
        }
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Signal signal = await();
        if (signal.error() != null) {
            finished = true;
            throw asUnavailable(signal.error());
        }
        if (signal.end()) {
            finished = true;
            return false;
        }
        pending = signal.text();
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String text = pending;
        pending = null;
        return text;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            queue.clear();
            // wakes up a consumer blocked in await()
            queue.add(new Signal(null, true, null));
            for (Runnable hook : cancelHooks) {
                try {
                    hook.run();
                } catch (RuntimeException ex) {
                    LOGGER.warn("Cancel hook failed: {}", ex.getMessage(), ex);
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * {@code true} once the producer signalled completion and every increment
     * was consumed.
     */
    public boolean isCompleted() {
        return finished && !cancelled.get();
    }

    @Override
    public void close() {
        if (!finished) {
            cancel();
        }
    }

    private Signal await() {
        try {
            Signal signal = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (signal == null) {
                cancel();
                finished = true;
                throw new GenerationUnavailableException("No answer increment received within " + timeout);
            }
            return signal;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancel();
            finished = true;
            throw new GenerationUnavailableException("Interrupted while waiting for the answer", ex);
        }
    }

    private static CapabilityException asUnavailable(Throwable error) {
        if (error instanceof CapabilityException capability) {
            return capability;
        }
        return new GenerationUnavailableException("Answer generation failed: " + error.getMessage(), error);
    }

    /**
     * Producer side of the stream.
     */
    public final class Sink {

        private Sink() {
        }

        /**
         * @return {@code false} if the consumer cancelled and the producer
         *         should stop
         */
        public boolean emit(String text) {
            if (cancelled.get()) {
                return false;
            }
            if (text != null && !text.isEmpty()) {
                queue.add(new Signal(text, false, null));
            }
            return true;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        /**
         * Register an action run when the consumer cancels, for example to
         * close the underlying connection.
         */
        public void onCancel(Runnable hook) {
            cancelHooks.add(hook);
            if (cancelled.get()) {
                hook.run();
            }
        }

        void complete() {
            queue.add(new Signal(null, true, null));
        }

        void fail(Throwable error) {
            queue.add(new Signal(null, true, error));
        }
    }

    @FunctionalInterface
    public interface Producer {

        void produce(Sink sink);
    }

    private record Signal(String text, boolean end, Throwable error) {
    }
}
