package io.hearthwarrio.ariaindex.core;

/**
 * Line filters applied while assigning refs.
 * <p>
 * Filters work line by line on the flat dump: a dropped container's descendants stay in the output at their
 * original indentation.
 * <pre>
 * SnapshotOptions.defaults().withInteractiveOnly(true).withMaxDepth(4)
 * </pre>
 */
public final class SnapshotOptions {

    private static final SnapshotOptions DEFAULTS = new SnapshotOptions(false, null, false);

    private final boolean interactiveOnly;
    private final Integer maxDepth;
    private final boolean compact;

    private SnapshotOptions(boolean interactiveOnly, Integer maxDepth, boolean compact) {
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.interactiveOnly = interactiveOnly;
        this.maxDepth = maxDepth;
        this.compact = compact;
    }

    /**
     * No filtering: every element line is kept.
     */
    public static SnapshotOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Keep only lines with an interactive role.
     */
    public SnapshotOptions withInteractiveOnly(boolean value) {
        return new SnapshotOptions(value, maxDepth, compact);
    }

    /**
     * Drop lines deeper than {@code value}; {@code null} means unbounded.
     */
    public SnapshotOptions withMaxDepth(Integer value) {
        return new SnapshotOptions(interactiveOnly, value, compact);
    }

    /**
     * Drop unnamed structural lines.
     */
    public SnapshotOptions withCompact(boolean value) {
        return new SnapshotOptions(interactiveOnly, maxDepth, value);
    }

    public boolean isInteractiveOnly() {
        return interactiveOnly;
    }

    public Integer getMaxDepth() {
        return maxDepth;
    }

    public boolean isCompact() {
        return compact;
    }

    @Override
    public String toString() {
        return "SnapshotOptions{" +
                "interactiveOnly=" + interactiveOnly +
                ", maxDepth=" + maxDepth +
                ", compact=" + compact +
                '}';
    }
}
