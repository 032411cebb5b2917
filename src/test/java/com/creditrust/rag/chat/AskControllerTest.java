package com.creditrust.rag.chat;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.creditrust.rag.ComplaintFixtures;
import com.creditrust.rag.error.ApiError;
import com.creditrust.rag.error.GenerationUnavailableException;
import com.creditrust.rag.error.GlobalExceptionHandler;
import com.creditrust.rag.error.IndexNotReadyException;
import com.creditrust.rag.index.ScoredChunk;

class AskControllerTest {

    private final QuestionAnsweringService service = mock(QuestionAnsweringService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AskController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsTheAnswerWithCitations() throws Exception {
        Citation citation = Citation.of(new ScoredChunk(ComplaintFixtures.chunk(ComplaintFixtures.LATE_FEE, 0, 40,
                "I was charged a late fee."), 0.61d), 200);
        when(service.ask("Why was I charged a fee?", 3))
                .thenReturn(new Answer("A late fee was charged.", AnswerStatus.GROUNDED, List.of(citation), 1.0d));

        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Why was I charged a fee?\",\"k\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("A late fee was charged."))
                .andExpect(jsonPath("$.noAnswer").value(false))
                .andExpect(jsonPath("$.status").value("GROUNDED"))
                .andExpect(jsonPath("$.citations[0].documentId").value(ComplaintFixtures.LATE_FEE))
                .andExpect(jsonPath("$.citations[0].snippet").value("I was charged a late fee."))
                .andExpect(jsonPath("$.citations[0].span.start").value(0));
    }

    @Test
    void flagsMissingAnswers() throws Exception {
        when(service.ask(eq("What is the weather today?"), any())).thenReturn(Answer.insufficientInformation());

        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"What is the weather today?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.noAnswer").value(true))
                .andExpect(jsonPath("$.citations").isEmpty());
    }

    @Test
    void rejectsBlankQuestions() throws Exception {
        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON).content("{\"question\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
                .andExpect(jsonPath("$.path").value("/api/ask"));
        verifyNoInteractions(service);
    }

    @Test
    void rejectsOutOfRangeTopK() throws Exception {
        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Why was I charged a fee?\",\"k\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }

    @Test
    void mapsCapabilityFailuresToServiceUnavailable() throws Exception {
        when(service.ask(any(), any())).thenThrow(new GenerationUnavailableException("generation call failed"));

        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Why was I charged a fee?\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value(ApiError.GENERATION_UNAVAILABLE))
                .andExpect(jsonPath("$.message")
                        .value("Answer generation is temporarily unavailable. Please try again later."))
                .andExpect(jsonPath("$.errorId").isNotEmpty());
    }

    @Test
    void mapsAMissingIndexToServiceUnavailable() throws Exception {
        when(service.ask(any(), any())).thenThrow(new IndexNotReadyException("No index has been published yet"));

        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Why was I charged a fee?\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value(ApiError.INDEX_NOT_READY));
    }
}
