package com.creditrust.rag.chat;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.index.RetrievalResult;
import com.creditrust.rag.retrieval.Retriever;

/**
 * Coordinates the retrieval of complaint excerpts and delegates the answer
 * generation to the {@link AnswerService}.
 */
public class QuestionAnsweringService {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuestionAnsweringService.class);

    private final Retriever retriever;
    private final PromptAssembler promptAssembler;
    private final AnswerService answerService;
    private final Executor chatExecutor;
    private final int defaultTopK;
    private final int maxContextSize;

    public QuestionAnsweringService(Retriever retriever, PromptAssembler promptAssembler, AnswerService answerService,
            Executor chatExecutor, int defaultTopK, int maxContextSize) {
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.promptAssembler = Objects.requireNonNull(promptAssembler, "promptAssembler");
        this.answerService = Objects.requireNonNull(answerService, "answerService");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
        this.defaultTopK = defaultTopK;
        this.maxContextSize = maxContextSize;
    }

    /**
     * Answer a question and wait for the complete answer.
     *
     * @param k number of excerpts to retrieve, {@code null} for the configured
     *          default
     */
    public Answer ask(String question, Integer k) {
        Prompt prompt = prompt(question, k);
        Answer answer = answerService.answer(prompt);
        LOGGER.debug("Answered '{}' with status {} and {} citations", question, answer.status(),
                answer.citations().size());
        return answer;
    }

    public AnswerStream askStreaming(String question, Integer k) {
        return answerService.stream(prompt(question, k));
    }

    /**
     * Answer on the chat executor and report increments to {@code handler}.
     * The returned subscription cancels the answer at any point.
     */
    public Subscription streamAnswer(String question, Integer k, StreamingResponseHandler handler) {
        Objects.requireNonNull(handler, "handler");
        Subscription subscription = new Subscription();
        chatExecutor.execute(() -> {
            try {
                if (subscription.isCancelled()) {
                    return;
                }
                AnswerStream stream = askStreaming(question, k);
                subscription.attach(stream);
                while (stream.hasNext()) {
                    handler.onToken(stream.next());
                }
                if (!stream.isCancelled()) {
                    handler.onComplete(stream.answer());
                }
            } catch (Exception ex) {
                LOGGER.error("Failed to produce response for question '{}': {}", question, ex.getMessage(), ex);
                handler.onError(ex);
            }
        });
        return subscription;
    }

    private Prompt prompt(String question, Integer k) {
        int topK = k == null ? defaultTopK : k;
        RetrievalResult result = retriever.retrieve(question, topK, maxContextSize);
        return promptAssembler.assemble(question, result);
    }

    /**
     * Callback API allowing to react to the streaming behaviour of the service.
     */
    public interface StreamingResponseHandler {

        void onToken(String token);

        void onComplete(Answer answer);

        void onError(Throwable throwable);
    }

    /**
     * Handle on a running streamed answer.
     */
    public static final class Subscription {

        private final AtomicReference<AnswerStream> stream = new AtomicReference<>();
        private final AtomicBoolean cancelled = new AtomicBoolean();

        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                AnswerStream current = stream.get();
                if (current != null) {
                    current.cancel();
                }
            }
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        void attach(AnswerStream answerStream) {
            stream.set(answerStream);
            if (cancelled.get()) {
                answerStream.cancel();
            }
        }
    }
}
