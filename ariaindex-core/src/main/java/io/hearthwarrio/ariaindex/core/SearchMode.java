package io.hearthwarrio.ariaindex.core;

import java.util.Locale;

/**
 * How a search query is matched against node text.
 */
public enum SearchMode {

    /**
     * Case-insensitive substring containment.
     */
    FUZZY,

    /**
     * Case-insensitive regular expression, found anywhere in the text.
     */
    REGEX;

    /**
     * Parses {@code "fuzzy"} / {@code "regex"} in any case.
     *
     * @param raw mode name
     * @return parsed mode
     * @throws IllegalArgumentException for unknown names
     */
    public static SearchMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Search mode must not be null or blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "fuzzy":
                return FUZZY;
            case "regex":
                return REGEX;
            default:
                throw new IllegalArgumentException("Unknown search mode: " + raw);
        }
    }

    /**
     * Lowercase name used in rendered headers.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
