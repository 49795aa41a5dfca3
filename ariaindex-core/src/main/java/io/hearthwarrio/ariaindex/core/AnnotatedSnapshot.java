package io.hearthwarrio.ariaindex.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot text with {@code [ref=@eN]} markers plus the ref map those markers point into.
 */
public final class AnnotatedSnapshot {

    private final String tree;
    private final Map<String, RefTarget> refs;

    public AnnotatedSnapshot(String tree, Map<String, RefTarget> refs) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.refs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(refs, "refs must not be null")));
    }

    public String getTree() {
        return tree;
    }

    /**
     * Ref id (e.g. {@code "e3"}, used as {@code "@e3"}) to target, in assignment order.
     */
    public Map<String, RefTarget> getRefs() {
        return refs;
    }

    @Override
    public String toString() {
        return tree;
    }
}
