package com.creditrust.rag.eval;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import com.creditrust.rag.chat.Answer;
import com.creditrust.rag.chat.Citation;
import com.creditrust.rag.chat.QuestionAnsweringService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs a question set through the full question answering path and grades
 * each answer. Questions run concurrently on the evaluation executor; a
 * failing question is recorded on its own row and does not stop the others.
 */
public class Evaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);

    static final String DEFAULT_QUESTIONS = "evaluation/questions.json";

    private final QuestionAnsweringService questionAnsweringService;
    private final AnswerClassifier classifier;
    private final Executor evaluationExecutor;

    public Evaluator(QuestionAnsweringService questionAnsweringService, AnswerClassifier classifier,
            Executor evaluationExecutor) {
        this.questionAnsweringService = Objects.requireNonNull(questionAnsweringService, "questionAnsweringService");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.evaluationExecutor = Objects.requireNonNull(evaluationExecutor, "evaluationExecutor");
    }

    public EvaluationReport evaluate(List<EvaluationQuestion> questions) {
        LOGGER.info("Evaluating {} questions", questions.size());
        List<CompletableFuture<EvaluationRow>> futures = new ArrayList<>(questions.size());
        for (EvaluationQuestion question : questions) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(question), evaluationExecutor));
        }
        List<EvaluationRow> rows = futures.stream().map(CompletableFuture::join).toList();
        EvaluationReport report = EvaluationReport.of(rows);
        LOGGER.info("Evaluation finished: {}", report.counts());
        return report;
    }

    EvaluationRow evaluate(EvaluationQuestion question) {
        try {
            Answer answer = questionAnsweringService.ask(question.question(), null);
            Quality quality = classifier.classify(answer, question.expectedTopic());
            List<String> sources = answer.citations().stream().map(Evaluator::describe).toList();
            return new EvaluationRow(question.question(), question.expectedTopic(), answer.text(), quality, sources,
                    null);
        } catch (RuntimeException ex) {
            LOGGER.warn("Evaluation of '{}' failed: {}", question.question(), ex.getMessage());
            return EvaluationRow.failed(question, ex);
        }
    }

    /**
     * The question set bundled with the application.
     */
    public static List<EvaluationQuestion> defaultQuestions(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(DEFAULT_QUESTIONS).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<EvaluationQuestion>>() {
            });
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + DEFAULT_QUESTIONS, ex);
        }
    }

    private static String describe(Citation citation) {
        return citation.product() == null ? citation.documentId()
                : citation.documentId() + " (" + citation.product() + ")";
    }
}
