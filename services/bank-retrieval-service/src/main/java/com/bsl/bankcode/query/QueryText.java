package com.bsl.bankcode.query;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class QueryText {
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{IsPunctuation}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryText() {
    }

    /**
     * NFKC-folds the text (full-width letters and digits become ASCII), turns
     * punctuation into spaces and collapses whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String value = Normalizer.normalize(text, Normalizer.Form.NFKC);
        value = PUNCTUATION.matcher(value).replaceAll(" ");
        value = WHITESPACE.matcher(value).replaceAll(" ");
        return value.trim();
    }

    /**
     * Normalized, without any whitespace and lower-cased. Used as the equality key
     * for bank names and for substring checks.
     */
    public static String compact(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return normalized;
        }
        return normalized.replace(" ", "").toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
