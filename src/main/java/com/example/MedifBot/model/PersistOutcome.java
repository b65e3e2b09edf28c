package com.example.MedifBot.model;

/**
 * Result of a transcript write. Failures are reported here instead of thrown,
 * because the visitor already has the answer by the time we persist.
 */
public record PersistOutcome(boolean saved, String error) {

    public static PersistOutcome ok() {
        return new PersistOutcome(true, null);
    }

    public static PersistOutcome failed(Throwable cause) {
        return new PersistOutcome(false, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
}
