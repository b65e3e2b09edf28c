package com.example.MedifBot.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidMessageException.class)
    public ResponseEntity<ApiError> handleInvalidMessage(InvalidMessageException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ApiError.INVALID_MESSAGE, ex.getMessage(), request);
    }

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<ApiError> handleRetrieval(RetrievalException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Retrieval failed [{}]: {}", errorId, ex.getMessage(), ex);
        return build(errorId, HttpStatus.INTERNAL_SERVER_ERROR, ApiError.RETRIEVAL_ERROR, ex.getUserMessage(), request);
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ApiError> handleGeneration(GenerationException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Generation failed [{}]: {}", errorId, ex.getMessage(), ex);
        return build(errorId, HttpStatus.INTERNAL_SERVER_ERROR, ApiError.GENERATION_ERROR, ex.getUserMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Unexpected error [{}]", errorId, ex);
        return build(errorId, HttpStatus.INTERNAL_SERVER_ERROR, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, String message, HttpServletRequest request) {
        return build(generateErrorId(), status, code, message, request);
    }

    private ResponseEntity<ApiError> build(String errorId,
                                           HttpStatus status,
                                           String code,
                                           String message,
                                           HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ApiError.builder()
                        .errorId(errorId)
                        .code(code)
                        .message(message)
                        .path(request.getRequestURI())
                        .timestamp(Instant.now())
                        .build());
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
