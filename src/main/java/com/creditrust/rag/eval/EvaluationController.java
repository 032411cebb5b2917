package com.creditrust.rag.eval;

import java.util.List;

import jakarta.validation.Valid;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs evaluations over posted or bundled question sets. The bundled set can
 * also be rendered as a Markdown table.
 */
@RestController
@RequestMapping("/api/evaluation")
@Validated
public class EvaluationController {

    private final Evaluator evaluator;
    private final ObjectMapper objectMapper;

    public EvaluationController(Evaluator evaluator, ObjectMapper objectMapper) {
        this.evaluator = evaluator;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public EvaluationReport evaluate(@RequestBody List<@Valid EvaluationQuestion> questions) {
        return evaluator.evaluate(questions);
    }

    @GetMapping(path = "/default", produces = MediaType.APPLICATION_JSON_VALUE)
    public EvaluationReport evaluateDefault() {
        return evaluator.evaluate(Evaluator.defaultQuestions(objectMapper));
    }

    @GetMapping(path = "/default", produces = MediaType.TEXT_MARKDOWN_VALUE)
    public String evaluateDefaultAsMarkdown() {
        return evaluator.evaluate(Evaluator.defaultQuestions(objectMapper)).toMarkdown();
    }
}
