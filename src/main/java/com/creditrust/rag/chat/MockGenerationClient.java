package com.creditrust.rag.chat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

import com.creditrust.rag.index.ScoredChunk;

/**
 * Deterministic {@link GenerationClient} used in tests and local development
 * where the OpenAI API should not be contacted. It answers with the opening
 * sentence of the best excerpt, word by word, and refuses when the prompt
 * carries no excerpts.
 */
public class MockGenerationClient implements GenerationClient {

    static final int MAX_EXCERPT = 300;

    private final Executor executor;
    private final Duration timeout;

    public MockGenerationClient(Executor executor, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public GenerationStream generate(Prompt prompt) {
        List<String> increments = increments(prompt);
        return GenerationStream.produce(executor, timeout, sink -> {
            for (String increment : increments) {
                if (!sink.emit(increment)) {
                    return;
                }
            }
        });
    }

    static List<String> increments(Prompt prompt) {
        String answer;
        if (!prompt.hasContext()) {
            answer = Answer.INSUFFICIENT_INFORMATION_TEXT;
        } else {
            ScoredChunk best = prompt.sources().get(0);
            answer = "Complaint " + best.chunk().documentId() + " reports: " + openingSentence(best.chunk().text());
        }
        List<String> increments = new ArrayList<>();
        String[] words = answer.split(" ");
        for (int i = 0; i < words.length; i++) {
            increments.add(i == 0 ? words[i] : " " + words[i]);
        }
        return increments;
    }

    private static String openingSentence(String text) {
        String stripped = text.strip().replaceAll("\\s+", " ");
        int end = stripped.length();
        for (int i = 0; i < stripped.length() - 1; i++) {
            char c = stripped.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && stripped.charAt(i + 1) == ' ') {
                end = i + 1;
                break;
            }
        }
        return stripped.substring(0, Math.min(end, MAX_EXCERPT));
    }
}
