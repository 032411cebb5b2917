package com.creditrust.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import com.creditrust.rag.ComplaintFixtures;
import com.creditrust.rag.error.GenerationUnavailableException;
import com.creditrust.rag.index.RetrievalResult;
import com.creditrust.rag.index.ScoredChunk;
import com.creditrust.rag.retry.CapabilityRetry;

class AnswerServiceTest {

    private static final String LATE_FEE_TEXT = "I was charged a late fee on my credit card even though I paid on time.";

    private final GenerationClient generationClient = mock(GenerationClient.class);
    private final PromptAssembler assembler = new PromptAssembler();

    @Test
    void shortCircuitsWithoutContext() {
        AnswerService service = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG);

        Answer answer = service.answer(assembler.assemble("What is the weather today?", RetrievalResult.empty()));

        assertThat(answer.status()).isEqualTo(AnswerStatus.INSUFFICIENT_INFORMATION);
        assertThat(answer.text()).isEqualTo(Answer.INSUFFICIENT_INFORMATION_TEXT);
        assertThat(answer.citations()).isEmpty();
        verifyNoInteractions(generationClient);
    }

    @Test
    void discardsTextGeneratedWithoutContext() {
        when(generationClient.generate(any())).thenReturn(GenerationStream.of(List.of("It is sunny and 25 degrees.")));
        AnswerService service = service(EmptyContextPolicy.CALL_WITH_EMPTY_CONTEXT, UnattributedPolicy.FLAG);

        Answer answer = service.answer(assembler.assemble("What is the weather today?", RetrievalResult.empty()));

        assertThat(answer.noAnswer()).isTrue();
        assertThat(answer.status()).isEqualTo(AnswerStatus.INSUFFICIENT_INFORMATION);
        assertThat(answer.text()).isEqualTo(Answer.INSUFFICIENT_INFORMATION_TEXT);
        assertThat(answer.citations()).isEmpty();
    }

    @Test
    void keepsARefusalGeneratedWithoutContext() {
        when(generationClient.generate(any())).thenReturn(GenerationStream.of(
                List.of("I do not have enough information about the weather.")));
        AnswerService service = service(EmptyContextPolicy.CALL_WITH_EMPTY_CONTEXT, UnattributedPolicy.FLAG);

        Answer answer = service.answer(assembler.assemble("What is the weather today?", RetrievalResult.empty()));

        assertThat(answer.text()).isEqualTo("I do not have enough information about the weather.");
        assertThat(answer.citations()).isEmpty();
    }

    @Test
    void groundsAnAnswerSupportedByTheExcerpts() {
        when(generationClient.generate(any()))
                .thenReturn(GenerationStream.of(List.of("You were charged ", "a late fee ", "on your credit card.")));
        AnswerService service = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG);

        Answer answer = service.answer(lateFeePrompt());

        assertThat(answer.status()).isEqualTo(AnswerStatus.GROUNDED);
        assertThat(answer.text()).isEqualTo("You were charged a late fee on your credit card.");
        assertThat(answer.attribution()).isEqualTo(1.0d);
        assertThat(answer.citations()).singleElement().satisfies(citation -> {
            assertThat(citation.documentId()).isEqualTo(ComplaintFixtures.LATE_FEE);
            assertThat(citation.product()).isEqualTo("Credit card");
            assertThat(citation.snippet()).isEqualTo(LATE_FEE_TEXT.substring(0, 20) + "...");
        });
    }

    @Test
    void recognisesRefusals() {
        when(generationClient.generate(any())).thenReturn(GenerationStream.of(
                List.of("I don’t have enough information to answer this.")));
        AnswerService service = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG);

        Answer answer = service.answer(lateFeePrompt());

        assertThat(answer.status()).isEqualTo(AnswerStatus.INSUFFICIENT_INFORMATION);
        assertThat(answer.citations()).isEmpty();
    }

    @Test
    void appliesThePolicyToUnsupportedAnswers() {
        when(generationClient.generate(any()))
                .thenAnswer(invocation -> GenerationStream.of(List.of("Interest rates rose sharply yesterday.")));

        Answer flagged = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG).answer(lateFeePrompt());
        Answer kept = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.KEEP).answer(lateFeePrompt());
        Answer refused = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.REFUSE).answer(lateFeePrompt());

        assertThat(flagged.status()).isEqualTo(AnswerStatus.UNATTRIBUTED);
        assertThat(flagged.citations()).hasSize(1);
        assertThat(flagged.attribution()).isZero();
        assertThat(kept.status()).isEqualTo(AnswerStatus.GROUNDED);
        assertThat(refused.status()).isEqualTo(AnswerStatus.INSUFFICIENT_INFORMATION);
        assertThat(refused.citations()).isEmpty();
    }

    @Test
    void retriesStartingTheGeneration() {
        when(generationClient.generate(any()))
                .thenThrow(new ResourceAccessException("connection refused"))
                .thenReturn(GenerationStream.of(List.of("A late fee was charged.")));
        AnswerService service = new AnswerService(generationClient, new CapabilityRetry(2, Duration.ofMillis(1), 1.0d),
                EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG, 0.5d, 20);

        Answer answer = service.answer(lateFeePrompt());

        assertThat(answer.status()).isEqualTo(AnswerStatus.GROUNDED);
        verify(generationClient, times(2)).generate(any());
    }

    @Test
    void reportsAnUnavailableGeneration() {
        when(generationClient.generate(any())).thenThrow(new ResourceAccessException("connection refused"));
        AnswerService service = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG);

        assertThatThrownBy(() -> service.answer(lateFeePrompt()))
                .isInstanceOf(GenerationUnavailableException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void streamsIncrementsBeforeTheAnswer() {
        when(generationClient.generate(any())).thenReturn(GenerationStream.of(List.of("Late ", "fee ", "charged.")));
        AnswerService service = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG);

        List<String> increments = new ArrayList<>();
        try (AnswerStream stream = service.stream(lateFeePrompt())) {
            assertThatThrownBy(stream::answer).isInstanceOf(IllegalStateException.class);
            stream.forEachRemaining(increments::add);

            assertThat(increments).containsExactly("Late ", "fee ", "charged.");
            assertThat(stream.answer().status()).isEqualTo(AnswerStatus.GROUNDED);
        }
    }

    @Test
    void cancellingDiscardsThePartialAnswer() {
        when(generationClient.generate(any())).thenReturn(GenerationStream.of(List.of("Late ", "fee ", "charged.")));
        AnswerService service = service(EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG);

        AnswerStream stream = service.stream(lateFeePrompt());
        assertThat(stream.next()).isEqualTo("Late ");
        stream.cancel();

        assertThat(stream.hasNext()).isFalse();
        assertThat(stream.isCancelled()).isTrue();
        assertThat(stream.answer()).isEqualTo(Answer.cancelled());
        assertThat(stream.answer().noAnswer()).isTrue();
    }

    @Test
    void measuresAttributionOnContentWords() {
        List<ScoredChunk> sources = List.of(new ScoredChunk(
                ComplaintFixtures.chunk("1", 0, 30, "The wire transfer was delayed."), 0.5d));

        assertThat(AnswerService.attribution("The transfer was delayed by the bank.", sources))
                .isCloseTo(2.0d / 3.0d, within(1e-9));
        assertThat(AnswerService.attribution("...", sources)).isZero();
    }

    private AnswerService service(EmptyContextPolicy emptyContextPolicy, UnattributedPolicy unattributedPolicy) {
        return new AnswerService(generationClient, CapabilityRetry.none(), emptyContextPolicy, unattributedPolicy,
                0.5d, 20);
    }

    private Prompt lateFeePrompt() {
        return assembler.assemble("Why was I charged a fee?", new RetrievalResult(List.of(
                new ScoredChunk(ComplaintFixtures.chunk(ComplaintFixtures.LATE_FEE, 0, 70, LATE_FEE_TEXT), 0.6d))));
    }
}
