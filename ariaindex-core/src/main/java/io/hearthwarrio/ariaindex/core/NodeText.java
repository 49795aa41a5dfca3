package io.hearthwarrio.ariaindex.core;

import java.util.regex.Pattern;

/**
 * Text helpers shared by the index builder, search engine and resolver.
 */
public final class NodeText {

    /**
     * Role of bare text wrappers in a snapshot ({@code - text: Hello}).
     */
    public static final String TEXT_ROLE = "text";

    public static final String ELLIPSIS = "…";

    private static final Pattern REF_MARKER = Pattern.compile("\\[ref=@e\\d+\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NodeText() {
        // utility class
    }

    /**
     * Removes ref markers, collapses whitespace and strips a leading colon.
     *
     * @param suffix raw suffix (may be null)
     * @return cleaned suffix, never null
     */
    public static String cleanSuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return "";
        }
        String cleaned = REF_MARKER.matcher(suffix).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.startsWith(":")) {
            cleaned = cleaned.substring(1).trim();
        }
        return cleaned;
    }

    /**
     * Cuts text to {@code limit} characters and marks the cut with an ellipsis.
     */
    public static String truncate(String text, int limit) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, Math.max(0, limit)) + ELLIPSIS;
    }

    /**
     * The accessible name when present, otherwise the cleaned suffix.
     */
    public static String textValue(ParsedNode node) {
        if (node.hasName()) {
            return node.getName();
        }
        return cleanSuffix(node.getRawSuffix());
    }

    /**
     * {@code role "text"} with the text truncated, or just the role when there is no text.
     */
    public static String label(ParsedNode node, int textLimit) {
        String hint = truncate(textValue(node), textLimit);
        if (hint.isEmpty()) {
            return node.getRole();
        }
        return node.getRole() + " \"" + hint + "\"";
    }

    /**
     * Extracts a window of text around the first match of {@code matcher}.
     * <p>
     * The window keeps at least 8 characters (or a third of {@code limit}) on each side of the match, marks cuts
     * with an ellipsis and is truncated to {@code limit} afterwards. Text without a match is only truncated.
     *
     * @param text    source text
     * @param matcher compiled query
     * @param limit   maximum snippet length
     * @return snippet, empty for empty text
     */
    public static String snippet(String text, QueryMatcher matcher, int limit) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int[] span = matcher.find(text);
        if (span == null) {
            return truncate(text, limit);
        }
        int context = Math.max(8, limit / 3);
        int left = Math.max(0, span[0] - context);
        int right = Math.min(text.length(), span[1] + context);
        left = Math.min(left, right);

        StringBuilder sb = new StringBuilder();
        if (left > 0) {
            sb.append(ELLIPSIS);
        }
        sb.append(text, left, right);
        if (right < text.length()) {
            sb.append(ELLIPSIS);
        }
        return truncate(sb.toString(), limit);
    }

    /**
     * Joins non-empty parts with a single space.
     */
    public static String joinNonEmpty(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p == null || p.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(p);
        }
        return sb.toString();
    }
}
