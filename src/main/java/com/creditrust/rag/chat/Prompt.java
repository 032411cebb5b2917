package com.creditrust.rag.chat;

import java.util.List;
import java.util.Objects;

import com.creditrust.rag.index.ScoredChunk;

/**
 * Fully assembled input for the generation capability together with the
 * chunks that were placed into it.
 */
public record Prompt(String instruction, String context, String question, List<ScoredChunk> sources) {

    public Prompt {
        Objects.requireNonNull(instruction, "instruction");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(question, "question");
        sources = List.copyOf(sources);
    }

    public boolean hasContext() {
        return !sources.isEmpty();
    }

    public String render() {
        return instruction + "\n\nContext:\n" + context + "\n\nQuestion: " + question + "\n\nAnswer:";
    }
}
