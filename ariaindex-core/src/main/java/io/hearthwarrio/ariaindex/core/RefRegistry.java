package io.hearthwarrio.ariaindex.core;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current ref map for one page.
 * <p>
 * Every {@link #publish(Map)} replaces the previous map and bumps the generation, so callers that remember the
 * generation they were handed can detect that their refs went stale instead of silently hitting a different element.
 * <p>
 * Thread-safe: publishing is an atomic swap.
 */
public final class RefRegistry {

    private final AtomicReference<RefMap> current = new AtomicReference<>(RefMap.INITIAL);

    /**
     * Replaces the current map.
     *
     * @param refs refs from one {@link ReferenceAssigner#assignRefs(String, SnapshotOptions)} call
     * @return the published map with its new generation
     */
    public RefMap publish(Map<String, RefTarget> refs) {
        Objects.requireNonNull(refs, "refs must not be null");
        return current.updateAndGet(prev -> new RefMap(prev.getGeneration() + 1, refs));
    }

    public RefMap current() {
        return current.get();
    }

    public long generation() {
        return current.get().getGeneration();
    }

    /**
     * Resolves against whatever map is current.
     *
     * @throws UnknownRefException if the id is unknown
     */
    public RefTarget resolve(String refId) {
        return current.get().get(refId);
    }

    /**
     * Resolves only if the map is still the one published as {@code generation}.
     *
     * @throws StaleRefException   if a newer map has replaced it
     * @throws UnknownRefException if the id is unknown
     */
    public RefTarget resolve(String refId, long generation) {
        RefMap map = current.get();
        if (map.getGeneration() != generation) {
            throw new StaleRefException(RefMap.normalize(refId), generation, map.getGeneration());
        }
        return map.get(refId);
    }

    /**
     * Drops all refs (e.g. when the page closes); the generation still advances.
     */
    public RefMap clear() {
        return publish(Map.of());
    }
}
