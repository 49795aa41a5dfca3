package io.hearthwarrio.ariaindex.core;

import java.util.Objects;

/**
 * Maps an index path back to a {@link RefTarget} that an interaction layer can turn into a locator.
 * <p>
 * Anonymous text wrappers are not addressable on their own; they resolve to their nearest nameable ancestor.
 * {@code nth} is recomputed over the full, unfiltered tree, so it may differ from the {@code nth} that
 * {@link ReferenceAssigner} issued for a filtered rendering of the same element.
 */
public class PathLocatorResolver {

    /**
     * Resolves a path.
     *
     * @param tree parsed snapshot
     * @param path index path, e.g. {@code "0/2/1"}
     * @return role, name and (when the pair is not unique) nth of the addressable node
     * @throws PathNotFoundException      if the path is not part of the tree
     * @throws UnresolvablePathException if the path is an anonymous text node with no nameable ancestor
     */
    public RefTarget resolvePath(SnapshotTree tree, String path) {
        Objects.requireNonNull(tree, "tree must not be null");

        ParsedNode node = tree.nodeAt(path);
        ParsedNode target = addressableNodeOrNull(tree, node);
        if (target == null) {
            throw new UnresolvablePathException(path);
        }

        String name = target.hasName() ? target.getName() : null;
        return new RefTarget(target.getRole(), name, nth(tree, target));
    }

    /**
     * Returns {@code node} itself unless it is an anonymous text wrapper, otherwise its nearest nameable ancestor.
     *
     * @return addressable node, or {@code null} if the whole ancestor chain is anonymous text
     */
    public static ParsedNode addressableNodeOrNull(SnapshotTree tree, ParsedNode node) {
        if (!node.isAnonymousText()) {
            return node;
        }
        return nearestNameableAncestorOrNull(tree, node);
    }

    /**
     * Walks up from {@code node} past anonymous text wrappers.
     *
     * @return first ancestor that has a name or a non-text role, or {@code null} if there is none
     */
    public static ParsedNode nearestNameableAncestorOrNull(SnapshotTree tree, ParsedNode node) {
        ParsedNode current = tree.parentOf(node);
        while (current != null) {
            if (!current.isAnonymousText()) {
                return current;
            }
            current = tree.parentOf(current);
        }
        return null;
    }

    /**
     * Position of {@code target} among nodes sharing its (role, name) pair, in tree order.
     * <p>
     * For an unnamed target every node of the same role counts, since a role-only locator matches named and unnamed
     * elements alike.
     *
     * @return zero-based index, or {@code null} if the pair is unique in the tree
     */
    static Integer nth(SnapshotTree tree, ParsedNode target) {
        int before = 0;
        int total = 0;
        for (ParsedNode candidate : tree.getNodes()) {
            if (!sameKey(candidate, target)) {
                continue;
            }
            if (candidate.getId() < target.getId()) {
                before++;
            }
            total++;
        }
        return total > 1 ? before : null;
    }

    private static boolean sameKey(ParsedNode candidate, ParsedNode target) {
        if (!candidate.getRole().equals(target.getRole())) {
            return false;
        }
        if (!target.hasName()) {
            return true;
        }
        return target.getName().equals(candidate.getName());
    }
}
