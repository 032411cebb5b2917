package com.creditrust.rag.chat;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.error.GenerationUnavailableException;
import com.creditrust.rag.index.ScoredChunk;
import com.creditrust.rag.ingest.TextTokens;
import com.creditrust.rag.retry.CapabilityRetry;

/**
 * Turns a prompt into an {@link Answer}. Starting the generation is retried;
 * the finished text is checked against the excerpts it cites and refusals are
 * recognised, so that an answer is only reported as grounded when its words
 * can be traced back to the complaints.
 */
public class AnswerService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerService.class);

    private static final List<String> REFUSAL_MARKERS = List.of(
            "don't have enough information",
            "do not have enough information",
            "not enough information",
            "cannot answer this question based on the provided context");

    private final GenerationClient generationClient;
    private final CapabilityRetry retry;
    private final EmptyContextPolicy emptyContextPolicy;
    private final UnattributedPolicy unattributedPolicy;
    private final double minAttribution;
    private final int snippetLength;

    public AnswerService(GenerationClient generationClient, CapabilityRetry retry,
            EmptyContextPolicy emptyContextPolicy, UnattributedPolicy unattributedPolicy, double minAttribution,
            int snippetLength) {
        this.generationClient = Objects.requireNonNull(generationClient, "generationClient");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.emptyContextPolicy = Objects.requireNonNull(emptyContextPolicy, "emptyContextPolicy");
        this.unattributedPolicy = Objects.requireNonNull(unattributedPolicy, "unattributedPolicy");
        if (minAttribution < 0.0d || minAttribution > 1.0d) {
            throw new ConfigurationException("Minimum attribution must be within [0, 1] but was " + minAttribution);
        }
        if (snippetLength < 1) {
            throw new ConfigurationException("Snippet length must be at least 1 but was " + snippetLength);
        }
        this.minAttribution = minAttribution;
        this.snippetLength = snippetLength;
    }

    /**
     * Generate and wait for the complete answer.
     */
    public Answer answer(Prompt prompt) {
        try (AnswerStream stream = stream(prompt)) {
            while (stream.hasNext()) {
                stream.next();
            }
            return stream.answer();
        }
    }

    public AnswerStream stream(Prompt prompt) {
        Objects.requireNonNull(prompt, "prompt");
        if (!prompt.hasContext() && emptyContextPolicy == EmptyContextPolicy.SHORT_CIRCUIT) {
            LOGGER.debug("No context retrieved, answering without generation");
            return AnswerStream.completed(Answer.insufficientInformation());
        }
        GenerationStream generation = retry.execute("generation", () -> generationClient.generate(prompt),
                GenerationUnavailableException::new);
        return new AnswerStream(generation, text -> finish(prompt, text));
    }

    Answer finish(Prompt prompt, String generated) {
        String text = generated.strip();
        if (!prompt.hasContext()) {
            // without excerpts only a refusal may be passed through
            return isRefusal(text) ? Answer.insufficientInformation(text) : Answer.insufficientInformation();
        }
        if (text.isEmpty() || isRefusal(text)) {
            LOGGER.debug("Model declined to answer from {} sources", prompt.sources().size());
            return Answer.insufficientInformation(text.isEmpty() ? Answer.INSUFFICIENT_INFORMATION_TEXT : text);
        }
        List<Citation> citations = prompt.sources().stream()
                .map(source -> Citation.of(source, snippetLength))
                .toList();
        double attribution = attribution(text, prompt.sources());
        if (attribution >= minAttribution) {
            return new Answer(text, AnswerStatus.GROUNDED, citations, attribution);
        }
        LOGGER.warn("Answer attribution {} is below {}, applying policy {}",
                String.format(Locale.ROOT, "%.2f", attribution), minAttribution, unattributedPolicy);
        switch (unattributedPolicy) {
            case KEEP:
                return new Answer(text, AnswerStatus.GROUNDED, citations, attribution);
            case REFUSE:
                return Answer.insufficientInformation();
            default:
                return new Answer(text, AnswerStatus.UNATTRIBUTED, citations, attribution);
        }
    }

    static boolean isRefusal(String text) {
        String normalized = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        return REFUSAL_MARKERS.stream().anyMatch(normalized::contains);
    }

    /**
     * Share of the distinct content words of {@code text} that occur in any of
     * the sources.
     */
    static double attribution(String text, List<ScoredChunk> sources) {
        Set<String> answerTokens = TextTokens.distinct(text);
        if (answerTokens.isEmpty()) {
            return 0.0d;
        }
        Set<String> sourceTokens = new HashSet<>();
        for (ScoredChunk source : sources) {
            sourceTokens.addAll(TextTokens.tokenize(source.chunk().text()));
        }
        long supported = answerTokens.stream().filter(sourceTokens::contains).count();
        return (double) supported / answerTokens.size();
    }
}
