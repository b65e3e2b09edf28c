package com.example.MedifBot.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Error body returned by {@link GlobalExceptionHandler}. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    public static final String RETRIEVAL_ERROR = "RETRIEVAL_ERROR";
    public static final String GENERATION_ERROR = "GENERATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    String errorId;
    String code;
    String message;
    String path;
    Instant timestamp;
}
