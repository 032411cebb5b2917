package com.creditrust.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.creditrust.rag.ComplaintFixtures;
import com.creditrust.rag.error.IndexNotReadyException;
import com.creditrust.rag.index.RetrievalResult;
import com.creditrust.rag.index.ScoredChunk;
import com.creditrust.rag.retrieval.Retriever;
import com.creditrust.rag.retry.CapabilityRetry;

class QuestionAnsweringServiceTest {

    private final Retriever retriever = mock(Retriever.class);
    private final GenerationClient generationClient = mock(GenerationClient.class);
    private final AnswerService answerService = new AnswerService(generationClient, CapabilityRetry.none(),
            EmptyContextPolicy.SHORT_CIRCUIT, UnattributedPolicy.FLAG, 0.5d, 200);

    @Test
    void usesTheConfiguredTopKByDefault() {
        when(retriever.retrieve("Why was I charged a fee?", 5, 6000)).thenReturn(lateFee());
        when(generationClient.generate(any())).thenReturn(GenerationStream.of(List.of("A late fee was charged.")));

        Answer answer = service(Runnable::run).ask("Why was I charged a fee?", null);

        assertThat(answer.status()).isEqualTo(AnswerStatus.GROUNDED);
        assertThat(answer.citations()).extracting(Citation::documentId).containsExactly(ComplaintFixtures.LATE_FEE);
        verify(retriever).retrieve("Why was I charged a fee?", 5, 6000);
    }

    @Test
    void passesTheRequestedTopK() {
        when(retriever.retrieve("What is the weather today?", 2, 6000)).thenReturn(RetrievalResult.empty());

        Answer answer = service(Runnable::run).ask("What is the weather today?", 2);

        assertThat(answer.noAnswer()).isTrue();
        verifyNoInteractions(generationClient);
    }

    @Test
    void streamsTokensThenTheAnswer() {
        when(retriever.retrieve("Why was I charged a fee?", 5, 6000)).thenReturn(lateFee());
        when(generationClient.generate(any()))
                .thenReturn(GenerationStream.of(List.of("A late ", "fee was ", "charged.")));
        RecordingHandler handler = new RecordingHandler();

        service(Runnable::run).streamAnswer("Why was I charged a fee?", null, handler);

        assertThat(handler.tokens).containsExactly("A late ", "fee was ", "charged.");
        assertThat(handler.answer.get().text()).isEqualTo("A late fee was charged.");
        assertThat(handler.errors).isEmpty();
    }

    @Test
    void reportsFailuresToTheHandler() {
        IndexNotReadyException failure = new IndexNotReadyException("No index has been published yet");
        when(retriever.retrieve("Why was I charged a fee?", 5, 6000)).thenThrow(failure);
        RecordingHandler handler = new RecordingHandler();

        service(Runnable::run).streamAnswer("Why was I charged a fee?", null, handler);

        assertThat(handler.errors).containsExactly(failure);
        assertThat(handler.answer.get()).isNull();
    }

    @Test
    void doesNothingWhenCancelledBeforeStart() {
        List<Runnable> tasks = new ArrayList<>();
        RecordingHandler handler = new RecordingHandler();

        QuestionAnsweringService.Subscription subscription = service(tasks::add)
                .streamAnswer("Why was I charged a fee?", null, handler);
        subscription.cancel();
        tasks.forEach(Runnable::run);

        assertThat(subscription.isCancelled()).isTrue();
        assertThat(handler.tokens).isEmpty();
        assertThat(handler.answer.get()).isNull();
        verifyNoInteractions(retriever, generationClient);
    }

    @Test
    void cancellingStopsTheStreamWithoutAnAnswer() {
        when(retriever.retrieve("Why was I charged a fee?", 5, 6000)).thenReturn(lateFee());
        when(generationClient.generate(any())).thenAnswer(invocation -> GenerationStream.produce(Runnable::run,
                Duration.ofSeconds(1), sink -> {
                    sink.emit("A late ");
                    sink.emit("fee ");
                }));
        AtomicReference<QuestionAnsweringService.Subscription> subscription = new AtomicReference<>();
        List<Runnable> tasks = new ArrayList<>();
        RecordingHandler handler = new RecordingHandler() {
            @Override
            public void onToken(String token) {
                super.onToken(token);
                subscription.get().cancel();
            }
        };

        subscription.set(service(tasks::add).streamAnswer("Why was I charged a fee?", null, handler));
        tasks.forEach(Runnable::run);

        assertThat(handler.tokens).containsExactly("A late ");
        assertThat(handler.answer.get()).isNull();
        assertThat(handler.errors).isEmpty();
    }

    private QuestionAnsweringService service(Executor executor) {
        return new QuestionAnsweringService(retriever, new PromptAssembler(), answerService, executor, 5, 6000);
    }

    private static RetrievalResult lateFee() {
        return new RetrievalResult(List.of(new ScoredChunk(ComplaintFixtures.chunk(ComplaintFixtures.LATE_FEE, 0, 60,
                "I was charged a late fee on my credit card."), 0.6d)));
    }

    private static class RecordingHandler implements QuestionAnsweringService.StreamingResponseHandler {

        final List<String> tokens = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        final AtomicReference<Answer> answer = new AtomicReference<>();

        @Override
        public void onToken(String token) {
            tokens.add(token);
        }

        @Override
        public void onComplete(Answer completed) {
            answer.set(completed);
        }

        @Override
        public void onError(Throwable throwable) {
            errors.add(throwable);
        }
    }
}
