package io.hearthwarrio.ariaindex.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One element line of an accessibility snapshot.
 * <p>
 * Nodes live in a {@link SnapshotTree} arena and refer to each other by integer id:
 * <ul>
 *   <li>{@link #getChildren()} holds child ids in document order</li>
 *   <li>{@link #getParentId()} is a back-reference used for traversal only (-1 for roots)</li>
 * </ul>
 * The path is assigned exactly once, by {@link PathAssigner}, after the whole tree is linked.
 */
public final class ParsedNode {

    public static final int NO_PARENT = -1;

    private final int id;
    private final String role;
    private final String name;
    private final String rawSuffix;
    private final int depth;
    private final int parentId;
    private final List<Integer> children = new ArrayList<>();
    private final List<Integer> childrenView = Collections.unmodifiableList(children);

    private String path;

    ParsedNode(int id, String role, String name, String rawSuffix, int depth, int parentId) {
        this.id = id;
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.name = name;
        this.rawSuffix = rawSuffix == null ? "" : rawSuffix;
        this.depth = depth;
        this.parentId = parentId;
    }

    public int getId() {
        return id;
    }

    /**
     * Lowercase role token, e.g. {@code button}.
     */
    public String getRole() {
        return role;
    }

    /**
     * Quoted accessible name, or {@code null} when the line carried none.
     * An empty quoted name ({@code ""}) is kept as an empty string.
     */
    public String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    /**
     * Free text after the role and name, e.g. {@code " [checked]"} or {@code ": value"}.
     */
    public String getRawSuffix() {
        return rawSuffix;
    }

    public int getDepth() {
        return depth;
    }

    public int getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    public List<Integer> getChildren() {
        return childrenView;
    }

    /**
     * Slash-delimited sibling indices from a root, e.g. {@code "0/2/1"}.
     */
    public String getPath() {
        return path;
    }

    /**
     * Anonymous text wrappers cannot be targeted individually.
     */
    public boolean isAnonymousText() {
        return NodeText.TEXT_ROLE.equals(role) && !hasName();
    }

    void addChild(int childId) {
        children.add(childId);
    }

    void assignPath(String value) {
        if (path != null) {
            throw new IllegalStateException("Path already assigned for node " + id + ": " + path);
        }
        this.path = Objects.requireNonNull(value, "path must not be null");
    }

    @Override
    public String toString() {
        return "ParsedNode{" +
                "id=" + id +
                ", role='" + role + '\'' +
                ", name=" + (name == null ? "null" : "'" + name + "'") +
                ", depth=" + depth +
                ", path='" + path + '\'' +
                '}';
    }
}
