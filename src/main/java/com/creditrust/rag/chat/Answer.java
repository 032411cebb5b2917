package com.creditrust.rag.chat;

import java.util.List;
import java.util.Objects;

/**
 * Final, materialized answer to a question.
 *
 * @param attribution share of the answer's content words found in the cited
 *                    excerpts, {@code 0} when nothing was cited
 */
public record Answer(String text, AnswerStatus status, List<Citation> citations, double attribution) {

    public static final String INSUFFICIENT_INFORMATION_TEXT =
            "I don't have enough information from the retrieved context to answer this question.";

    public Answer {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(status, "status");
        citations = List.copyOf(citations);
    }

    public static Answer insufficientInformation() {
        return insufficientInformation(INSUFFICIENT_INFORMATION_TEXT);
    }

    public static Answer insufficientInformation(String text) {
        return new Answer(text, AnswerStatus.INSUFFICIENT_INFORMATION, List.of(), 0.0d);
    }

    public static Answer cancelled() {
        return new Answer("", AnswerStatus.CANCELLED, List.of(), 0.0d);
    }

    public boolean noAnswer() {
        return status == AnswerStatus.INSUFFICIENT_INFORMATION || status == AnswerStatus.CANCELLED;
    }
}
