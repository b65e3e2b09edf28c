package com.example.MedifBot.exception;

/** The chat model failed or produced no usable text. */
public class GenerationException extends RuntimeException {

    public static final String USER_MESSAGE =
            "Hubo un problema al generar la respuesta. Por favor, intentalo de nuevo.";

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getUserMessage() {
        return USER_MESSAGE;
    }
}
