package com.creditrust.rag.chat;

import jakarta.validation.Valid;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Blocking question endpoint returning the complete answer as JSON.
 */
@RestController
@RequestMapping(path = "/api/ask", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class AskController {

    private final QuestionAnsweringService questionAnsweringService;

    public AskController(QuestionAnsweringService questionAnsweringService) {
        this.questionAnsweringService = questionAnsweringService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public AskResponse ask(@Valid @RequestBody ChatRequest request) {
        return AskResponse.of(questionAnsweringService.ask(request.question(), request.k()));
    }
}
