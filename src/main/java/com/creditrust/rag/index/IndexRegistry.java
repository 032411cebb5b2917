package com.creditrust.rag.index;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.error.IndexCorruptionException;
import com.creditrust.rag.error.IndexNotReadyException;

/**
 * Holds the currently published index snapshot. Readers acquire the snapshot
 * once per query and keep using it even if a rebuild publishes a newer one in
 * the meantime.
 */
public class IndexRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexRegistry.class);

    private final AtomicReference<State> state = new AtomicReference<>(new State(Status.EMPTY, null, null));
    private final AtomicLong versions = new AtomicLong();
    private final Clock clock;

    public IndexRegistry() {
        this(Clock.systemUTC());
    }

    public IndexRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return the published snapshot
     * @throws IndexCorruptionException if the persisted index was found
     *                                  corrupted and no rebuild has succeeded
     * @throws IndexNotReadyException   if nothing has been published yet
     */
    public IndexSnapshot current() {
        State current = state.get();
        switch (current.status()) {
            case READY:
                return current.snapshot();
            case CORRUPTED:
                throw new IndexCorruptionException("The vector index is corrupted and must be rebuilt: "
                        + current.problem());
            default:
                throw new IndexNotReadyException("No vector index has been published yet");
        }
    }

    public IndexSnapshot publish(VectorIndex index) {
        Objects.requireNonNull(index, "index");
        IndexSnapshot snapshot = new IndexSnapshot(versions.incrementAndGet(), index, clock.instant());
        State previous = state.getAndSet(new State(Status.READY, snapshot, null));
        LOGGER.info("Published index snapshot {} with {} vectors (previous state: {})", snapshot.version(),
                index.size(), previous.status());
        return snapshot;
    }

    public void markCorrupted(String problem) {
        state.set(new State(Status.CORRUPTED, null, problem));
        LOGGER.error("Vector index marked as corrupted, queries are refused until a rebuild: {}", problem);
    }

    public void teardown() {
        state.set(new State(Status.EMPTY, null, null));
        LOGGER.info("Vector index torn down");
    }

    public Status status() {
        return state.get().status();
    }

    public String problem() {
        return state.get().problem();
    }

    public IndexStatus describe() {
        State current = state.get();
        IndexSnapshot snapshot = current.snapshot();
        if (snapshot == null) {
            return new IndexStatus(current.status(), null, null, null, null, null, null, null, current.problem());
        }
        VectorIndex index = snapshot.index();
        return new IndexStatus(current.status(), snapshot.version(), index.size(), index.dimension(), index.metric(),
                index.corpusVersion(), index.approximate(), snapshot.publishedAt(), null);
    }

    public enum Status {
        EMPTY, READY, CORRUPTED
    }

    private record State(Status status, IndexSnapshot snapshot, String problem) {
    }
}
