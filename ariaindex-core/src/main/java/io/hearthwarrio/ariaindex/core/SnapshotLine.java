package io.hearthwarrio.ariaindex.core;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One matched element line of a snapshot dump: {@code <indent>- role "name" suffix}.
 * <p>
 * Indentation is measured in 2-space units. Lines whose role token starts with {@code /} are closing markers.
 */
final class SnapshotLine {

    static final int INDENT_WIDTH = 2;

    private static final Pattern ELEMENT = Pattern.compile("^(\\s*-\\s*)(/?\\w+)(?:\\s+\"([^\"]*)\")?(.*)$");
    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^(\\s*)");

    final String prefix;
    final String roleToken;
    final String role;
    final String name;
    final String suffix;
    final int depth;

    private SnapshotLine(String prefix, String roleToken, String name, String suffix, int depth) {
        this.prefix = prefix;
        this.roleToken = roleToken;
        this.role = roleToken.toLowerCase(Locale.ROOT);
        this.name = name;
        this.suffix = suffix == null ? "" : suffix;
        this.depth = depth;
    }

    /**
     * Parses a single line.
     *
     * @return parsed line, or {@code null} when the line is not an element line
     */
    static SnapshotLine parse(String line) {
        if (line == null) {
            return null;
        }
        Matcher m = ELEMENT.matcher(line);
        if (!m.matches()) {
            return null;
        }
        return new SnapshotLine(m.group(1), m.group(2), m.group(3), m.group(4), indentLevel(line));
    }

    static int indentLevel(String line) {
        Matcher m = LEADING_WHITESPACE.matcher(line);
        if (!m.find()) {
            return 0;
        }
        return m.group(1).length() / INDENT_WIDTH;
    }

    boolean isClosingMarker() {
        return roleToken.startsWith("/");
    }

    boolean hasName() {
        return name != null && !name.isEmpty();
    }

    static String[] splitLines(String text) {
        return text.split("\\r?\\n");
    }
}
