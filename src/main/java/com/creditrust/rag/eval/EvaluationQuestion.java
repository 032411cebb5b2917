package com.creditrust.rag.eval;

import jakarta.validation.constraints.NotBlank;

/**
 * A question together with the topic a good answer is expected to draw from,
 * typically a product category such as {@code "Credit card"}.
 */
public record EvaluationQuestion(@NotBlank String question, String expectedTopic) {
}
