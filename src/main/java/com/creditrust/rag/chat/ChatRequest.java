package com.creditrust.rag.chat;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for questions. {@code k} is optional and defaults to the
 * configured top-k.
 */
public record ChatRequest(@NotBlank String question, @Min(1) @Max(50) Integer k) {

    public ChatRequest(String question) {
        this(question, null);
    }
}
