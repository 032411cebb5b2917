package com.creditrust.rag.chat;

import java.io.IOException;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST endpoint exposing the chat functionality via server sent events. Every
 * text increment is sent as a {@code token} event and the final response,
 * citations included, as an {@code answer} event. Closing the connection
 * cancels the generation.
 */
@RestController
@RequestMapping(path = "/api/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
@Validated
public class ChatController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    static final String TOKEN_EVENT = "token";
    static final String ANSWER_EVENT = "answer";

    private final QuestionAnsweringService questionAnsweringService;
    private final SseEmitterFactory emitterFactory;

    public ChatController(QuestionAnsweringService questionAnsweringService, SseEmitterFactory emitterFactory) {
        this.questionAnsweringService = questionAnsweringService;
        this.emitterFactory = emitterFactory;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SseEmitter chat(@Valid @RequestBody ChatRequest request) {
        SseEmitter emitter = emitterFactory.create();
        QuestionAnsweringService.Subscription subscription = questionAnsweringService.streamAnswer(
                request.question(), request.k(), new QuestionAnsweringService.StreamingResponseHandler() {
                    @Override
                    public void onToken(String token) {
                        send(emitter, SseEmitter.event().name(TOKEN_EVENT).data(token));
                    }

                    @Override
                    public void onComplete(Answer answer) {
                        if (send(emitter, SseEmitter.event().name(ANSWER_EVENT).data(AskResponse.of(answer)))) {
                            emitter.complete();
                        }
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        emitter.completeWithError(throwable);
                    }
                });
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(error -> subscription.cancel());
        return emitter;
    }

    private static boolean send(SseEmitter emitter, SseEmitter.SseEventBuilder event) {
        try {
            emitter.send(event);
            return true;
        } catch (IOException | IllegalStateException ex) {
            LOGGER.warn("Unable to stream event, client is gone: {}", ex.getMessage());
            emitter.completeWithError(ex);
            return false;
        }
    }
}
