package io.hearthwarrio.ariaindex.core;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled search query. Matching is always case-insensitive.
 */
public final class QueryMatcher {

    private final String query;
    private final SearchMode mode;
    private final Pattern pattern;
    private final String needle;

    private QueryMatcher(String query, SearchMode mode, Pattern pattern, String needle) {
        this.query = query;
        this.mode = mode;
        this.pattern = pattern;
        this.needle = needle;
    }

    /**
     * Compiles a query for the given mode.
     *
     * @throws InvalidQueryException if {@code mode} is {@link SearchMode#REGEX} and the pattern is malformed
     */
    public static QueryMatcher compile(String query, SearchMode mode) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        if (mode == SearchMode.REGEX) {
            try {
                Pattern p = Pattern.compile(query, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                return new QueryMatcher(query, mode, p, null);
            } catch (PatternSyntaxException e) {
                throw new InvalidQueryException(query, e);
            }
        }
        return new QueryMatcher(query, mode, null, query.toLowerCase(Locale.ROOT));
    }

    public String getQuery() {
        return query;
    }

    public SearchMode getMode() {
        return mode;
    }

    public boolean matches(String text) {
        return find(text) != null;
    }

    /**
     * Returns {@code [start, end)} of the first match, or {@code null} when there is none.
     */
    int[] find(String text) {
        if (text == null) {
            return null;
        }
        if (pattern != null) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) {
                return null;
            }
            return new int[]{m.start(), m.end()};
        }
        int start = text.toLowerCase(Locale.ROOT).indexOf(needle);
        if (start < 0) {
            return null;
        }
        return new int[]{start, start + needle.length()};
    }
}
