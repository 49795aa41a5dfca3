package io.hearthwarrio.ariaindex.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Renders a bounded, path-addressed listing of a {@link SnapshotTree}.
 * <p>
 * Expansion rules:
 * <ul>
 *   <li>unscoped calls (no path) expand only the roots' direct children; deeper structure is requested by path</li>
 *   <li>scoped calls expand from the given node down to {@code depth} levels</li>
 *   <li>a node whose children are not expanded gets a preview of its first three children, each with a short
 *       summary of prioritized descendant texts, and a {@code +K more} count</li>
 * </ul>
 * The total number of rendered nodes is capped; a trailing line reports truncation.
 */
public class SnapshotIndexBuilder {

    static final int PREVIEW_CHILDREN = 3;
    static final int SUMMARY_ITEMS = 6;

    static final Set<String> SUMMARY_ROLES = Set.of(
            "heading", "button", "link", "textbox", "combobox", "listbox",
            "checkbox", "radio", "menuitem", "tab", "option", "searchbox", "switch"
    );

    /**
     * Builds the index listing.
     *
     * @param tree      parsed snapshot
     * @param path      start node, or {@code null} for all roots
     * @param depth     levels to expand below the start
     * @param maxNodes  cap on rendered nodes
     * @param textLimit cap on each text hint
     * @return listing, or {@code "(empty)"} for an empty tree
     * @throws PathNotFoundException if {@code path} is not part of the tree
     */
    public String buildIndex(SnapshotTree tree, String path, int depth, int maxNodes, int textLimit) {
        Objects.requireNonNull(tree, "tree must not be null");

        if (tree.isEmpty()) {
            return ReferenceAssigner.EMPTY;
        }

        List<Integer> startIds = path == null ? tree.getRoots() : List.of(tree.nodeAt(path).getId());

        Render render = new Render(tree, path != null, depth, maxNodes, textLimit);
        render.lines.add("index (path=" + (path == null ? "root" : path) +
                ", depth=" + depth + ", max_nodes=" + maxNodes + ")");
        render.nodes(startIds);

        if (render.counter >= maxNodes && render.counter < tree.size()) {
            render.lines.add("... (truncated: returned " + render.counter + " of " + tree.size() + ")");
        }
        return String.join("\n", render.lines);
    }

    /**
     * Same as {@link #buildIndex(SnapshotTree, String, int, int, int)} with bounds from {@code options}.
     */
    public String buildIndex(SnapshotTree tree, String path, IndexOptions options) {
        return buildIndex(tree, path, options.getDepth(), options.getMaxNodes(), options.getTextLimit());
    }

    /**
     * Breadth-first collection of up to {@code maxItems} distinct texts from prioritized roles, starting at
     * {@code nodeId} itself, joined by {@code " | "}.
     */
    static String collectSummary(SnapshotTree tree, int nodeId, int maxItems, int textLimit) {
        Set<String> seen = new HashSet<>();
        List<String> summary = new ArrayList<>();

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty() && summary.size() < maxItems) {
            ParsedNode node = tree.node(queue.poll());
            if (SUMMARY_ROLES.contains(node.getRole())) {
                String hint = NodeText.truncate(NodeText.textValue(node), textLimit);
                if (!hint.isEmpty() && seen.add(hint.toLowerCase(Locale.ROOT))) {
                    summary.add(hint);
                }
            }
            queue.addAll(node.getChildren());
        }
        return String.join(" | ", summary);
    }

    static String previewItem(SnapshotTree tree, ParsedNode node, int textLimit) {
        String summary = collectSummary(tree, node.getId(), SUMMARY_ITEMS, textLimit);
        String base = NodeText.label(node, textLimit) + " [path=" + node.getPath() + "]";
        return summary.isEmpty() ? base : base + " :: " + summary;
    }

    private static final class Render {
        private final SnapshotTree tree;
        private final boolean scoped;
        private final int depth;
        private final int maxNodes;
        private final int textLimit;
        private final List<String> lines = new ArrayList<>();
        private int counter;

        private Render(SnapshotTree tree, boolean scoped, int depth, int maxNodes, int textLimit) {
            this.tree = tree;
            this.scoped = scoped;
            this.depth = depth;
            this.maxNodes = maxNodes;
            this.textLimit = textLimit;
        }

        /**
         * Pre-order walk with an explicit stack, so deep scoped listings do not recurse.
         */
        private void nodes(List<Integer> startIds) {
            Deque<Frame> stack = new ArrayDeque<>();
            for (int i = startIds.size() - 1; i >= 0; i--) {
                stack.push(new Frame(startIds.get(i), 0, ""));
            }
            while (!stack.isEmpty() && counter < maxNodes) {
                Frame frame = stack.pop();
                List<Integer> children = node(frame);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(children.get(i), frame.depth + 1, frame.indent + "  "));
                }
            }
        }

        /**
         * Renders one line and returns the children to expand (empty when collapsed).
         */
        private List<Integer> node(Frame frame) {
            counter++;

            ParsedNode node = tree.node(frame.id);
            List<Integer> children = node.getChildren();
            boolean expand = frame.depth < depth && (scoped || frame.depth == 0);

            StringBuilder line = new StringBuilder(frame.indent)
                    .append("- ")
                    .append(NodeText.label(node, textLimit))
                    .append(" [path=").append(node.getPath()).append(']');

            if (!children.isEmpty() && !expand) {
                String preview = preview(children);
                if (!preview.isEmpty()) {
                    line.append(" (grandchildren: ").append(preview).append(')');
                }
            }
            lines.add(line.toString());

            return expand ? children : List.of();
        }

        private String preview(List<Integer> children) {
            int shown = Math.min(PREVIEW_CHILDREN, children.size());
            List<String> items = new ArrayList<>(shown + 1);
            for (int i = 0; i < shown; i++) {
                items.add(previewItem(tree, tree.node(children.get(i)), textLimit));
            }
            int extra = children.size() - shown;
            if (extra > 0) {
                items.add("+" + extra + " more");
            }
            return String.join("; ", items);
        }
    }

    private static final class Frame {
        private final int id;
        private final int depth;
        private final String indent;

        private Frame(int id, int depth, String indent) {
            this.id = id;
            this.depth = depth;
            this.indent = indent;
        }
    }
}
