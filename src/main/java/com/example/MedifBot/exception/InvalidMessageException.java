package com.example.MedifBot.exception;

/** Thrown when a chat message is empty after trimming. */
public class InvalidMessageException extends RuntimeException {

    public InvalidMessageException(String message) {
        super(message);
    }
}
