package com.creditrust.rag.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Default factory creating emitters with no timeout. Stalled generations are
 * detected by the answer stream itself, which waits at most the generation
 * timeout for each increment.
 */
public class DefaultSseEmitterFactory implements SseEmitterFactory {

    private static final Long NO_TIMEOUT = 0L;

    @Override
    public SseEmitter create() {
        return new SseEmitter(NO_TIMEOUT);
    }
}
