package com.creditrust.rag.eval;

import java.util.Locale;
import java.util.Set;

import com.creditrust.rag.chat.Answer;
import com.creditrust.rag.chat.AnswerStatus;
import com.creditrust.rag.chat.Citation;
import com.creditrust.rag.ingest.TextTokens;

/**
 * Assigns a {@link Quality} to an answer given the topic it was expected to
 * cover.
 */
public class AnswerClassifier {

    public Quality classify(Answer answer, String expectedTopic) {
        if (answer.citations().isEmpty()) {
            return Quality.REFUSED;
        }
        if (answer.status() != AnswerStatus.GROUNDED) {
            return Quality.UNGROUNDED;
        }
        if (expectedTopic == null || expectedTopic.isBlank()) {
            return Quality.GROUNDED_CORRECT;
        }
        boolean onTopic = answer.citations().stream().anyMatch(citation -> matches(citation, expectedTopic));
        return onTopic ? Quality.GROUNDED_CORRECT : Quality.GROUNDED_INCOMPLETE;
    }

    private static boolean matches(Citation citation, String topic) {
        String normalizedTopic = topic.strip().toLowerCase(Locale.ROOT);
        if (citation.product() != null && citation.product().toLowerCase(Locale.ROOT).contains(normalizedTopic)) {
            return true;
        }
        Set<String> topicTokens = TextTokens.distinct(topic);
        Set<String> snippetTokens = TextTokens.distinct(citation.snippet());
        return !topicTokens.isEmpty() && snippetTokens.containsAll(topicTokens);
    }
}
