package com.example.MedifBot.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text canonicalization used for loose comparisons (intent lookup, chunk dedup)
 * and for cleaning text before it is embedded.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1+");

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\u0000-\\u001f\\u007f-\\u009f]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Accent-, case-, punctuation- and elongation-insensitive form of {@code text}.
     * "¡Holaaa!!" and "hola" both become "hola". Never fails; null gives "".
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String cleaned = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        cleaned = cleaned.toLowerCase(Locale.ROOT);
        cleaned = NON_WORD.matcher(cleaned).replaceAll(" ");
        cleaned = REPEATED_CHAR.matcher(cleaned).replaceAll("$1");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    /**
     * NFC form with control characters removed and whitespace collapsed.
     * Keeps accents and case; this is what goes to the embedding model.
     */
    public static String cleanWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        composed = CONTROL_CHARS.matcher(composed).replaceAll(" ");
        return WHITESPACE.matcher(composed).replaceAll(" ").trim();
    }
}
