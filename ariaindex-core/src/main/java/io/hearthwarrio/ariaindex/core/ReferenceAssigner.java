package io.hearthwarrio.ariaindex.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Annotates a snapshot dump with sequential refs ({@code e1}, {@code e2}, ...) for actionable and named content nodes.
 * <p>
 * Duplicates are disambiguated in two passes over the retained lines:
 * <ol>
 *   <li>count every {@code (role, name-or-empty)} key</li>
 *   <li>walk again in the same order; keys seen more than once get a zero-based {@code nth} equal to the number of
 *       same-key refs already issued, unique keys get none</li>
 * </ol>
 * Each call produces a fresh ref map; nothing carries over between calls.
 */
public class ReferenceAssigner {

    static final String EMPTY = "(empty)";

    /**
     * Annotates the dump and builds the ref map.
     *
     * @param text    raw snapshot dump (may be null)
     * @param options line filters
     * @return annotated snapshot; {@code "(empty)"} with no refs when nothing is left
     */
    public AnnotatedSnapshot assignRefs(String text, SnapshotOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        if (text == null || text.isEmpty()) {
            return new AnnotatedSnapshot(EMPTY, Map.of());
        }

        List<Entry> retained = new ArrayList<>();
        Map<String, Integer> counts = new HashMap<>();

        for (String line : SnapshotLine.splitLines(text)) {
            SnapshotLine parsed = SnapshotLine.parse(line);
            if (parsed == null || parsed.isClosingMarker()) {
                retained.add(Entry.passthrough(line));
                continue;
            }
            if (!keep(parsed, options)) {
                continue;
            }
            String key = key(parsed);
            counts.merge(key, 1, Integer::sum);
            retained.add(Entry.element(parsed, key));
        }

        Map<String, RefTarget> refs = new LinkedHashMap<>();
        Map<String, Integer> issued = new HashMap<>();
        List<String> out = new ArrayList<>(retained.size());
        int refIndex = 0;

        for (Entry entry : retained) {
            if (entry.element == null) {
                out.add(entry.raw);
                continue;
            }

            SnapshotLine el = entry.element;
            StringBuilder sb = new StringBuilder(el.prefix).append(el.roleToken);
            if (el.hasName()) {
                sb.append(" \"").append(el.name).append('"');
            }

            if (RoleCategory.deservesRef(el.role, el.hasName())) {
                refIndex++;
                String refId = "e" + refIndex;

                Integer nth = null;
                if (counts.getOrDefault(entry.key, 0) > 1) {
                    nth = issued.getOrDefault(entry.key, 0);
                    issued.put(entry.key, nth + 1);
                }

                refs.put(refId, new RefTarget(el.role, el.hasName() ? el.name : null, nth));
                sb.append(" [ref=@").append(refId).append(']');
            }

            sb.append(el.suffix);
            out.add(sb.toString());
        }

        if (out.isEmpty()) {
            return new AnnotatedSnapshot(EMPTY, refs);
        }
        return new AnnotatedSnapshot(String.join("\n", out), refs);
    }

    private boolean keep(SnapshotLine line, SnapshotOptions options) {
        Integer maxDepth = options.getMaxDepth();
        if (maxDepth != null && line.depth > maxDepth) {
            return false;
        }

        RoleCategory category = RoleCategory.of(line.role);
        if (options.isInteractiveOnly() && category != RoleCategory.INTERACTIVE) {
            return false;
        }
        return !(options.isCompact() && category == RoleCategory.STRUCTURAL && !line.hasName());
    }

    private static String key(SnapshotLine line) {
        return line.role + ":" + (line.name == null ? "" : line.name);
    }

    private static final class Entry {
        private final String raw;
        private final SnapshotLine element;
        private final String key;

        private Entry(String raw, SnapshotLine element, String key) {
            this.raw = raw;
            this.element = element;
            this.key = key;
        }

        static Entry passthrough(String raw) {
            return new Entry(raw, null, null);
        }

        static Entry element(SnapshotLine element, String key) {
            return new Entry(null, element, key);
        }
    }
}
