package com.creditrust.rag.chat;

import java.util.List;

/**
 * Response body of a question. {@code noAnswer} is set when the complaints do
 * not support an answer; the citation list is empty in that case.
 */
public record AskResponse(String answer, boolean noAnswer, AnswerStatus status, List<Citation> citations) {

    public static AskResponse of(Answer answer) {
        return new AskResponse(answer.text(), answer.noAnswer(), answer.status(), answer.citations());
    }
}
