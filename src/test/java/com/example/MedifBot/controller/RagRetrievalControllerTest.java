package com.example.MedifBot.controller;

import com.example.MedifBot.exception.GlobalExceptionHandler;
import com.example.MedifBot.model.RetrievalResult;
import com.example.MedifBot.service.ContextRetrievalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RagRetrievalControllerTest {

    @Mock private ContextRetrievalService contextRetrievalService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RagRetrievalController(contextRetrievalService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void blankQuestionIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/rag/retrieve").param("q", "   "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_MESSAGE"));

        verifyNoInteractions(contextRetrievalService);
    }

    @Test
    void returnsRetrievedContextForStrippedQuestion() throws Exception {
        when(contextRetrievalService.retrieve("que cursos ofrecen"))
                .thenReturn(new RetrievalResult(List.of("Ofrecemos 9 cursos."), Set.of("cursos/"), 0.82, 1, 0, 1));

        mockMvc.perform(get("/api/rag/retrieve").param("q", "  que cursos ofrecen "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contextChunks[0]").value("Ofrecemos 9 cursos."))
                .andExpect(jsonPath("$.sourceFilters[0]").value("cursos/"))
                .andExpect(jsonPath("$.bestSimilarity").value(0.82));
    }
}
