package com.example.musiccollection.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical keys used to correlate the same release across the library and the catalog.
 */
public final class MatchKeys {

    public static final int MATCH_KEY_MAX_LENGTH = 500;
    public static final String SEPARATOR = " - ";

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String LEADING_ARTICLE = "the ";

    private MatchKeys() {
    }

    /**
     * Lowercases, drops everything but ASCII letters, digits and whitespace, collapses whitespace
     * and strips leading "the " articles. Null and empty input yield "". Applying it twice gives the
     * same result as applying it once, so stored keys can be re-normalized safely.
     */
    public static String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String lowered = value.toLowerCase(Locale.ROOT);
        String stripped = NON_ALNUM.matcher(lowered).replaceAll("");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        while (collapsed.startsWith(LEADING_ARTICLE)) {
            collapsed = collapsed.substring(LEADING_ARTICLE.length());
        }
        return collapsed;
    }

    public static String matchKey(String artist, String title) {
        String key = normalize(artist) + SEPARATOR + normalize(title);
        return truncate(key, MATCH_KEY_MAX_LENGTH);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
