package com.example.MedifBot.exception;

/** Embedding or vector search failed while gathering context. */
public class RetrievalException extends RuntimeException {

    public static final String USER_MESSAGE =
            "Lo siento, hubo un problema buscando en nuestra base de conocimiento. Intenta nuevamente.";

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getUserMessage() {
        return USER_MESSAGE;
    }
}
