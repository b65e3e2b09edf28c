package com.example.MedifBot.controller;

import com.example.MedifBot.exception.InvalidMessageException;
import com.example.MedifBot.model.RetrievalResult;
import com.example.MedifBot.service.ContextRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RagRetrievalController {

    private final ContextRetrievalService contextRetrievalService;

    /**
     * Inspect what the chat would retrieve for a question, without calling the chat model.
     *   GET /api/rag/retrieve?q=xxx
     * A blank question is rejected with 400 before anything is embedded.
     */
    @GetMapping("/retrieve")
    public RetrievalResult retrieve(@RequestParam("q") String question) {
        String stripped = question == null ? "" : question.strip();
        if (stripped.isEmpty()) {
            throw new InvalidMessageException("La pregunta no puede estar vacia.");
        }
        return contextRetrievalService.retrieve(stripped);
    }
}
