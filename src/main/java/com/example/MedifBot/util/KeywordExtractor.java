package com.example.MedifBot.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls content keywords out of a user message for the keyword fallback search.
 */
public final class KeywordExtractor {

    private KeywordExtractor() {
    }

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9]+");

    private static final int MIN_KEYWORD_LENGTH = 5;

    private static final int MIN_ACRONYM_LENGTH = 3;

    /** Interrogatives, without diacritics. */
    private static final Set<String> QUESTION_WORDS = Set.of(
            "quien", "quienes", "que", "como", "cuando", "donde", "por", "para",
            "cual", "cuales", "cuanto", "cuantos", "cuanta", "cuantas", "porque"
    );

    /**
     * Keywords in order of first occurrence, without duplicates.
     * A token is kept when it has at least 5 characters, or when it is written
     * fully upper-case with at least 3 characters ("CYPE", "SAP2000").
     */
    public static List<String> extract(String message) {
        if (message == null || message.isBlank()) {
            return List.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(message);
        while (matcher.find()) {
            String token = matcher.group();
            String lowered = token.toLowerCase(Locale.ROOT);
            if (QUESTION_WORDS.contains(lowered)) {
                continue;
            }
            if (lowered.length() >= MIN_KEYWORD_LENGTH
                    || (isUpperCase(token) && lowered.length() >= MIN_ACRONYM_LENGTH)) {
                keywords.add(lowered);
            }
        }
        return new ArrayList<>(keywords);
    }

    private static boolean isUpperCase(String token) {
        boolean hasLetter = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) {
                    return false;
                }
                hasLetter = true;
            }
        }
        return hasLetter;
    }
}
