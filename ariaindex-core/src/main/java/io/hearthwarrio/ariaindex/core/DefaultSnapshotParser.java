package io.hearthwarrio.ariaindex.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Indentation-stack parser.
 * <p>
 * Each element line becomes a node. Before attaching a node, stack entries whose depth is greater than or equal to
 * the node's depth are popped; the remaining top (if any) is the parent. Closing markers and non-element lines are
 * skipped. Paths are assigned once the whole tree is linked.
 */
public class DefaultSnapshotParser implements SnapshotParser {

    @Override
    public SnapshotTree parse(String text) {
        if (text == null || text.isBlank()) {
            return SnapshotTree.empty();
        }

        List<ParsedNode> nodes = new ArrayList<>();
        List<Integer> roots = new ArrayList<>();
        Deque<ParsedNode> stack = new ArrayDeque<>();

        for (String line : SnapshotLine.splitLines(text)) {
            SnapshotLine parsed = SnapshotLine.parse(line);
            if (parsed == null || parsed.isClosingMarker()) {
                continue;
            }

            while (!stack.isEmpty() && stack.peek().getDepth() >= parsed.depth) {
                stack.pop();
            }

            int id = nodes.size();
            ParsedNode parent = stack.peek();
            ParsedNode node = new ParsedNode(
                    id,
                    parsed.role,
                    parsed.name,
                    parsed.suffix,
                    parsed.depth,
                    parent == null ? ParsedNode.NO_PARENT : parent.getId()
            );

            if (parent == null) {
                roots.add(id);
            } else {
                parent.addChild(id);
            }
            nodes.add(node);
            stack.push(node);
        }

        Map<String, Integer> pathIndex = PathAssigner.assignPaths(nodes, roots);
        return new SnapshotTree(nodes, roots, pathIndex);
    }
}
