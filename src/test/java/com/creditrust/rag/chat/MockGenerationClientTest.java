package com.creditrust.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.creditrust.rag.ComplaintFixtures;
import com.creditrust.rag.index.RetrievalResult;
import com.creditrust.rag.index.ScoredChunk;

class MockGenerationClientTest {

    private final MockGenerationClient client = new MockGenerationClient(Runnable::run, Duration.ofSeconds(1));
    private final PromptAssembler assembler = new PromptAssembler();

    @Test
    void answersWithTheOpeningSentenceOfTheBestExcerpt() {
        Prompt prompt = assembler.assemble("Why was I charged?", new RetrievalResult(List.of(new ScoredChunk(
                ComplaintFixtures.chunk("42", 0, 60, "I was charged twice. Nobody called me back."), 0.7d))));

        StringBuilder answer = new StringBuilder();
        client.generate(prompt).forEachRemaining(answer::append);

        assertThat(answer).hasToString("Complaint 42 reports: I was charged twice.");
    }

    @Test
    void refusesWithoutContext() {
        Prompt prompt = assembler.assemble("What is the weather today?", RetrievalResult.empty());

        assertThat(String.join("", MockGenerationClient.increments(prompt)))
                .isEqualTo(Answer.INSUFFICIENT_INFORMATION_TEXT);
    }
}
