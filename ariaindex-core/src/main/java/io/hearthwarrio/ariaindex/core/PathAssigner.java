package io.hearthwarrio.ariaindex.core;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns every node a tree-order path of sibling indices and builds the path lookup.
 * <p>
 * Root {@code i} gets path {@code "i"}; child {@code j} of a node with path {@code P} gets {@code "P/j"}.
 */
public final class PathAssigner {

    public static final char SEPARATOR = '/';

    private PathAssigner() {
        // utility class
    }

    /**
     * Assigns paths depth-first. Must run exactly once per parse.
     *
     * @param nodes arena, index equals node id
     * @param roots root ids in document order
     * @return path to node id, in pre-order
     * @throws IllegalStateException if a node already has a path
     */
    public static Map<String, Integer> assignPaths(List<ParsedNode> nodes, List<Integer> roots) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(roots, "roots must not be null");

        Map<String, Integer> pathIndex = new LinkedHashMap<>();

        // explicit stack: deeply nested dumps should not blow the call stack
        Deque<Pending> pending = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(new Pending(roots.get(i), String.valueOf(i)));
        }

        while (!pending.isEmpty()) {
            Pending entry = pending.pop();
            String path = entry.path;

            ParsedNode node = nodes.get(entry.id);
            node.assignPath(path);
            pathIndex.put(path, entry.id);

            List<Integer> children = node.getChildren();
            for (int j = children.size() - 1; j >= 0; j--) {
                pending.push(new Pending(children.get(j), path + SEPARATOR + j));
            }
        }

        return Collections.unmodifiableMap(pathIndex);
    }

    private static final class Pending {
        private final int id;
        private final String path;

        private Pending(int id, String path) {
            this.id = id;
            this.path = path;
        }
    }

    /**
     * Number of separators in a path, i.e. depth below its root.
     */
    public static int pathDepth(String path) {
        int count = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == SEPARATOR) {
                count++;
            }
        }
        return count;
    }

    /**
     * Whether {@code path} equals {@code ancestor} or lies in its subtree (segment-aligned).
     */
    public static boolean isSameOrDescendant(String path, String ancestor) {
        return path.equals(ancestor) || path.startsWith(ancestor + SEPARATOR);
    }
}
