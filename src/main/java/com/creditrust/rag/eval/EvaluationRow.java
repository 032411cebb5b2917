package com.creditrust.rag.eval;

import java.util.List;

/**
 * Outcome of one evaluated question. {@code error} is only set for
 * {@link Quality#FAILED} rows.
 */
public record EvaluationRow(String question, String expectedTopic, String answer, Quality quality,
        List<String> sources, String error) {

    public EvaluationRow {
        sources = List.copyOf(sources);
    }

    static EvaluationRow failed(EvaluationQuestion question, Throwable error) {
        return new EvaluationRow(question.question(), question.expectedTopic(), "", Quality.FAILED, List.of(),
                error.getClass().getSimpleName() + ": " + error.getMessage());
    }
}
