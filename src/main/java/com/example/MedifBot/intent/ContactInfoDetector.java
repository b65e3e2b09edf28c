package com.example.MedifBot.intent;

/**
 * Heuristic check for a message that carries an e-mail address or a phone number.
 * It only triggers the acknowledgement path; it does not validate anything.
 */
public final class ContactInfoDetector {

    private ContactInfoDetector() {
    }

    private static final int MIN_PHONE_DIGITS = 6;

    public static boolean looksLikeContact(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String cleaned = message.replace(',', ' ').replace(';', ' ');
        for (String part : cleaned.split("\\s+")) {
            if (part.indexOf('@') >= 0 && part.indexOf('.') >= 0) {
                return true;
            }
        }
        long digits = message.chars().filter(Character::isDigit).count();
        return digits >= MIN_PHONE_DIGITS;
    }
}
