package io.hearthwarrio.ariaindex.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parsed snapshot: an index-addressed node arena plus root ids and the path lookup.
 * <p>
 * Created by {@link SnapshotParser#parse(String)} and never mutated afterwards.
 */
public final class SnapshotTree {

    private static final SnapshotTree EMPTY = new SnapshotTree(List.of(), List.of(), Map.of());

    private final List<ParsedNode> nodes;
    private final List<Integer> roots;
    private final Map<String, Integer> pathIndex;

    SnapshotTree(List<ParsedNode> nodes, List<Integer> roots, Map<String, Integer> pathIndex) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.roots = Collections.unmodifiableList(roots);
        this.pathIndex = pathIndex;
    }

    public static SnapshotTree empty() {
        return EMPTY;
    }

    /**
     * Convenience for {@code new DefaultSnapshotParser().parse(text)}.
     */
    public static SnapshotTree parse(String text) {
        return new DefaultSnapshotParser().parse(text);
    }

    /**
     * All nodes in tree order; list index equals node id.
     */
    public List<ParsedNode> getNodes() {
        return nodes;
    }

    public List<Integer> getRoots() {
        return roots;
    }

    public Map<String, Integer> getPathIndex() {
        return pathIndex;
    }

    public ParsedNode node(int id) {
        return nodes.get(id);
    }

    public boolean hasPath(String path) {
        return path != null && pathIndex.containsKey(path);
    }

    /**
     * Looks up a node by path.
     *
     * @throws PathNotFoundException if the path is not part of this parse
     */
    public ParsedNode nodeAt(String path) {
        Integer id = path == null ? null : pathIndex.get(path);
        if (id == null) {
            throw new PathNotFoundException(path);
        }
        return nodes.get(id);
    }

    /**
     * Parent of the given node, or {@code null} for roots.
     */
    public ParsedNode parentOf(ParsedNode node) {
        if (node.isRoot()) {
            return null;
        }
        return nodes.get(node.getParentId());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
