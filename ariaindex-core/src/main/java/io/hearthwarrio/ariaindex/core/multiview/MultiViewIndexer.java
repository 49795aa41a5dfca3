package io.hearthwarrio.ariaindex.core.multiview;

import io.hearthwarrio.ariaindex.core.NodeText;
import io.hearthwarrio.ariaindex.core.QueryMatcher;
import io.hearthwarrio.ariaindex.core.SearchMode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Index and search over {@link MultiViewData}.
 * <p>
 * Paths are view-prefixed: {@code v:structure/sN}, {@code v:content/bN}, {@code v:interact/iN}, {@code v:overlay/oN}.
 * A structure path scopes the listing to that heading and the deeper headings that follow it; the other view paths
 * scope their view to a single item.
 */
public class MultiViewIndexer {

    static final String EMPTY = "(empty)";

    private static final String STRUCTURE = "structure";
    private static final String CONTENT = "content";
    private static final String INTERACT = "interact";
    private static final String OVERLAY = "overlay";
    private static final List<String> VIEWS = List.of(STRUCTURE, CONTENT, INTERACT, OVERLAY);

    private static final Pattern STRUCTURE_PATH = Pattern.compile("v:structure/s(\\d+)");
    private static final Pattern CONTENT_PATH = Pattern.compile("v:content/b(\\d+)");
    private static final Pattern INTERACT_PATH = Pattern.compile("v:interact/i(\\d+)");
    private static final Pattern OVERLAY_PATH = Pattern.compile("v:overlay/o(\\d+)");

    private static final int MAX_HEADING_LEVEL = 6;
    private static final int SEARCH_DEPTH = 6;
    private static final int SEARCH_MIN_NODES = 200;

    /**
     * Renders one block per non-empty view.
     *
     * @param data      collected views
     * @param path      optional view path to scope to
     * @param depth     heading depth; headings deeper than {@code depth + 1} (max 6) are hidden
     * @param maxNodes  cap per non-structure view
     * @param textLimit cap on labels and summaries
     * @return listing (or {@code "(empty)"}) and the selectors behind its paths
     */
    public MultiViewIndex build(MultiViewData data, String path, int depth, int maxNodes, int textLimit) {
        Objects.requireNonNull(data, "data must not be null");

        Map<String, String> viewPaths = new LinkedHashMap<>();
        List<Item> items = collect(data, depth, textLimit, maxNodes, path, viewPaths);
        if (items.isEmpty()) {
            return new MultiViewIndex(EMPTY, viewPaths);
        }

        String pathLabel = path == null ? "root" : path;
        List<String> lines = new ArrayList<>();
        for (String view : VIEWS) {
            List<Item> viewItems = items.stream().filter(i -> i.view.equals(view)).collect(Collectors.toList());
            if (viewItems.isEmpty()) {
                continue;
            }
            lines.add("index (view=" + view + ", path=" + pathLabel + ", depth=" + depth + ", max_nodes=" + maxNodes + ")");
            if (STRUCTURE.equals(view)) {
                int minLevel = viewItems.stream().mapToInt(i -> i.level).filter(l -> l > 0).min().orElse(1);
                for (Item item : viewItems) {
                    String indent = "  ".repeat(Math.max(0, item.level - minLevel));
                    String line = indent + "- " + item.label + " [path=" + item.path + "]";
                    if (!item.summary.isEmpty()) {
                        line += " :: " + item.summary;
                    }
                    lines.add(line);
                }
            } else {
                for (Item item : viewItems) {
                    lines.add("- " + item.label + " [path=" + item.path + "]");
                }
            }
            lines.add("");
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return new MultiViewIndex(String.join("\n", lines), viewPaths);
    }

    /**
     * Searches every view at full heading depth.
     *
     * @return header plus matching lines sorted by path, {@code (empty)} when nothing matched; a bare
     * {@code "(empty)"} for a blank query
     * @throws io.hearthwarrio.ariaindex.core.InvalidQueryException for a malformed regex
     */
    public String search(MultiViewData data, String query, SearchMode mode, int limit, int textLimit) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (data == null || query == null || query.isEmpty()) {
            return EMPTY;
        }

        QueryMatcher matcher = QueryMatcher.compile(query, mode);
        List<Item> items = collect(data, SEARCH_DEPTH, textLimit, Math.max(SEARCH_MIN_NODES, limit * 10), null, new LinkedHashMap<>());

        List<Item> matches = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        for (Item item : items) {
            if (item.haystack.isEmpty() || !matcher.matches(item.haystack)) {
                continue;
            }
            matches.add(item);
            if (matches.size() >= limit * 4) {
                break;
            }
        }
        matches.sort(Comparator.comparing((Item i) -> i.path));

        Set<String> seen = new HashSet<>();
        for (Item item : matches) {
            if (!seen.add(item.path)) {
                continue;
            }
            String snippet = NodeText.snippet(item.haystack, matcher, textLimit);
            String label = item.label;
            if (!snippet.isEmpty() && !label.contains(snippet)) {
                label = label + " :: " + snippet;
            }
            lines.add("- " + label + " [path=" + item.path + "]");
            if (lines.size() >= limit) {
                break;
            }
        }

        String header = "search (query=\"" + query + "\", mode=" + mode.label() + ", limit=" + limit + ")";
        if (lines.isEmpty()) {
            return header + "\n" + EMPTY;
        }
        lines.add(0, header);
        return String.join("\n", lines);
    }

    private List<Item> collect(
            MultiViewData data,
            int depth,
            int textLimit,
            int maxNodes,
            String path,
            Map<String, String> viewPaths
    ) {
        List<MultiViewData.Section> sections = data.getSections();
        List<MultiViewData.Block> blocks = data.getBlocks();
        List<MultiViewData.Control> controls = data.getInteractions();
        List<MultiViewData.Overlay> overlays = data.getOverlays();

        int maxLevel = Math.min(MAX_HEADING_LEVEL, Math.max(1, depth + 1));

        List<Integer> sectionIdx = range(sections.size());
        List<Integer> blockIdx = range(blocks.size());
        List<Integer> controlIdx = range(controls.size());
        List<Integer> overlayIdx = range(overlays.size());

        if (path != null) {
            Matcher m = STRUCTURE_PATH.matcher(path);
            if (m.matches()) {
                int start = parseIndex(m.group(1));
                if (start >= 0 && start < sections.size()) {
                    int baseLevel = sections.get(start).getLevel();
                    sectionIdx = new ArrayList<>();
                    sectionIdx.add(start);
                    for (int i = start + 1; i < sections.size(); i++) {
                        if (sections.get(i).getLevel() <= baseLevel) {
                            break;
                        }
                        sectionIdx.add(i);
                    }
                }
            }
            blockIdx = scopeSingle(CONTENT_PATH, path, blocks.size(), blockIdx);
            controlIdx = scopeSingle(INTERACT_PATH, path, controls.size(), controlIdx);
            overlayIdx = scopeSingle(OVERLAY_PATH, path, overlays.size(), overlayIdx);
        }

        List<Item> items = new ArrayList<>();

        for (int idx : sectionIdx) {
            MultiViewData.Section section = sections.get(idx);
            int level = section.getLevel();
            if (level > maxLevel) {
                continue;
            }
            String title = NodeText.truncate(section.getTitle(), textLimit);
            if (title.isEmpty()) {
                continue;
            }
            String summary = NodeText.truncate(section.getSummary(), textLimit);
            String pathId = "v:structure/s" + idx;
            putSelector(viewPaths, pathId, section.getSelector());
            items.add(new Item(STRUCTURE, pathId, "heading \"" + title + "\"", summary, level,
                    NodeText.joinNonEmpty(title, summary, section.getAnchor())));
        }

        for (int idx : limit(blockIdx, maxNodes)) {
            MultiViewData.Block block = blocks.get(idx);
            String text = NodeText.truncate(block.getText(), textLimit);
            if (text.isEmpty()) {
                continue;
            }
            String pathId = "v:content/b" + idx;
            putSelector(viewPaths, pathId, block.getSelector());
            items.add(new Item(CONTENT, pathId, "block \"" + text + "\"", "", 0, text));
        }

        for (int idx : limit(controlIdx, maxNodes)) {
            MultiViewData.Control control = controls.get(idx);
            String label = NodeText.truncate(control.getLabel(), textLimit);
            if (label.isEmpty()) {
                continue;
            }
            String kind = control.getKind().isEmpty() ? "control" : control.getKind();
            String pathId = "v:interact/i" + idx;
            putSelector(viewPaths, pathId, control.getSelector());
            items.add(new Item(INTERACT, pathId, kind + " \"" + label + "\"", "", 0, kind + " " + label));
        }

        for (int idx : limit(overlayIdx, maxNodes)) {
            MultiViewData.Overlay overlay = overlays.get(idx);
            String label = NodeText.truncate(overlay.getLabel(), textLimit);
            if (label.isEmpty()) {
                continue;
            }
            String pathId = "v:overlay/o" + idx;
            putSelector(viewPaths, pathId, overlay.getSelector());
            items.add(new Item(OVERLAY, pathId, "dialog \"" + label + "\"", "", 0, label));
        }

        return items;
    }

    private static List<Integer> scopeSingle(Pattern pattern, String path, int size, List<Integer> fallback) {
        Matcher m = pattern.matcher(path);
        if (!m.matches()) {
            return fallback;
        }
        int start = parseIndex(m.group(1));
        return start >= 0 && start < size ? List.of(start) : List.of();
    }

    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static List<Integer> range(int size) {
        return IntStream.range(0, size).boxed().collect(Collectors.toList());
    }

    private static List<Integer> limit(List<Integer> indices, int maxNodes) {
        return indices.size() <= maxNodes ? indices : indices.subList(0, maxNodes);
    }

    private static void putSelector(Map<String, String> viewPaths, String pathId, String selector) {
        if (!selector.isEmpty()) {
            viewPaths.put(pathId, selector);
        }
    }

    private static final class Item {
        private final String view;
        private final String path;
        private final String label;
        private final String summary;
        private final int level;
        private final String haystack;

        private Item(String view, String path, String label, String summary, int level, String haystack) {
            this.view = view;
            this.path = path;
            this.label = label;
            this.summary = summary;
            this.level = level;
            this.haystack = haystack;
        }
    }
}
