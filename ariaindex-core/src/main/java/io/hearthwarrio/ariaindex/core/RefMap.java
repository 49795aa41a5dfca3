package io.hearthwarrio.ariaindex.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ref map tagged with the generation of the snapshot call that produced it.
 */
public final class RefMap {

    static final RefMap INITIAL = new RefMap(0L, Map.of());

    private final long generation;
    private final Map<String, RefTarget> refs;

    RefMap(long generation, Map<String, RefTarget> refs) {
        this.generation = generation;
        this.refs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(refs, "refs must not be null")));
    }

    /**
     * Generation number; 0 means no snapshot has been published yet.
     */
    public long getGeneration() {
        return generation;
    }

    public Map<String, RefTarget> getRefs() {
        return refs;
    }

    /**
     * Looks up a ref id, with or without the leading {@code @}.
     *
     * @throws UnknownRefException if the id is not part of this map
     */
    public RefTarget get(String refId) {
        String id = normalize(refId);
        RefTarget target = refs.get(id);
        if (target == null) {
            throw new UnknownRefException(id);
        }
        return target;
    }

    public boolean contains(String refId) {
        return refs.containsKey(normalize(refId));
    }

    public int size() {
        return refs.size();
    }

    /**
     * Strips a leading {@code @}: {@code "@e3"} and {@code "e3"} name the same ref.
     */
    public static String normalize(String refId) {
        Objects.requireNonNull(refId, "refId must not be null");
        String id = refId.trim();
        return id.startsWith("@") ? id.substring(1) : id;
    }

    /**
     * Whether a caller-supplied target string is a ref ({@code @eN}) rather than a CSS selector.
     */
    public static boolean isRef(String selectorOrRef) {
        return selectorOrRef != null && selectorOrRef.trim().startsWith("@");
    }

    @Override
    public String toString() {
        return "RefMap{generation=" + generation + ", refs=" + refs.keySet() + '}';
    }
}
