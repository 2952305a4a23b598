package com.valuebet.domain.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utilities for canonicalizing team, market and bet text before comparison.
 */
public final class TextNormalizer {

    private static final Pattern APOSTROPHES = Pattern.compile("['’]");
    private static final Pattern DASHES = Pattern.compile("[–—]");
    private static final Pattern STANDALONE_AMPERSAND = Pattern.compile("(?<!\\S)&(?!\\S)");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s.\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_NON_WORD =
        Pattern.compile("^\\W+|\\W+$", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    /**
     * Normalizes an alias for lookups.
     *
     * Rules:
     * 1. Trim
     * 2. Lowercase
     * 3. Remove apostrophes (' and ’)
     * Hyphens are kept since they distinguish some names.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return APOSTROPHES.matcher(normalized).replaceAll("");
    }

    /**
     * Prepares raw bet text for recognition.
     *
     * Example: "Ajax & Lazio!!!" -> "ajax and lazio"
     */
    public static String fullyNormalize(String input) {
        if (input == null) {
            return "";
        }
        String text = input.toLowerCase(Locale.ROOT);
        text = DASHES.matcher(text).replaceAll("-");
        text = STANDALONE_AMPERSAND.matcher(text).replaceAll("and");
        text = DISALLOWED.matcher(text).replaceAll("");
        return collapseWhitespace(text);
    }

    /**
     * Removes leading and trailing punctuation around a single token.
     */
    public static String cleanToken(String token) {
        return EDGE_NON_WORD.matcher(token).replaceAll("");
    }

    public static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Splits on whitespace, ignoring leading and trailing blanks.
     */
    public static String[] tokens(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }
}
