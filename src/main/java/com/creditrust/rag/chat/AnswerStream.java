package com.creditrust.rag.chat;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Text increments of an answer as they are generated. The {@link Answer} is
 * available once the stream has been consumed to the end or cancelled; a
 * cancelled stream discards the partial text.
 */
public final class AnswerStream implements Iterator<String>, AutoCloseable {

    private final GenerationStream generation;
    private final Function<String, Answer> finisher;
    private final StringBuilder text = new StringBuilder();
    private volatile Answer answer;

    AnswerStream(GenerationStream generation, Function<String, Answer> finisher) {
        this.generation = Objects.requireNonNull(generation, "generation");
        this.finisher = Objects.requireNonNull(finisher, "finisher");
    }

    /**
     * Stream that replays a fixed answer as a single increment.
     */
    static AnswerStream completed(Answer answer) {
        return new AnswerStream(GenerationStream.of(List.of(answer.text())), ignored -> answer);
    }

    @Override
    public boolean hasNext() {
        if (answer != null) {
            return false;
        }
        if (generation.hasNext()) {
            return true;
        }
        answer = generation.isCancelled() ? Answer.cancelled() : finisher.apply(text.toString());
        return false;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String increment = generation.next();
        text.append(increment);
        return increment;
    }

    public void cancel() {
        generation.cancel();
        if (answer == null) {
            answer = Answer.cancelled();
        }
    }

    public boolean isCancelled() {
        return generation.isCancelled();
    }

    /**
     * @throws IllegalStateException if the stream has neither completed nor
     *                               been cancelled
     */
    public Answer answer() {
        if (answer == null) {
            throw new IllegalStateException("The answer stream has not completed yet");
        }
        return answer;
    }

    @Override
    public void close() {
        if (answer == null) {
            cancel();
        }
    }
}
