package io.hearthwarrio.ariaindex.core;

/**
 * Bounds for index rendering and search output.
 */
public final class IndexOptions {

    public static final int DEFAULT_DEPTH = 1;
    public static final int DEFAULT_MAX_NODES = 200;
    public static final int DEFAULT_TEXT_LIMIT = 80;
    public static final int DEFAULT_SEARCH_LIMIT = 20;

    private static final IndexOptions DEFAULTS =
            new IndexOptions(DEFAULT_DEPTH, DEFAULT_MAX_NODES, DEFAULT_TEXT_LIMIT, DEFAULT_SEARCH_LIMIT);

    private final int depth;
    private final int maxNodes;
    private final int textLimit;
    private final int searchLimit;

    private IndexOptions(int depth, int maxNodes, int textLimit, int searchLimit) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got " + depth);
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be >= 1, got " + maxNodes);
        }
        if (textLimit < 1) {
            throw new IllegalArgumentException("textLimit must be >= 1, got " + textLimit);
        }
        if (searchLimit < 1) {
            throw new IllegalArgumentException("searchLimit must be >= 1, got " + searchLimit);
        }
        this.depth = depth;
        this.maxNodes = maxNodes;
        this.textLimit = textLimit;
        this.searchLimit = searchLimit;
    }

    public static IndexOptions defaults() {
        return DEFAULTS;
    }

    public IndexOptions withDepth(int value) {
        return new IndexOptions(value, maxNodes, textLimit, searchLimit);
    }

    public IndexOptions withMaxNodes(int value) {
        return new IndexOptions(depth, value, textLimit, searchLimit);
    }

    public IndexOptions withTextLimit(int value) {
        return new IndexOptions(depth, maxNodes, value, searchLimit);
    }

    public IndexOptions withSearchLimit(int value) {
        return new IndexOptions(depth, maxNodes, textLimit, value);
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public int getTextLimit() {
        return textLimit;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    @Override
    public String toString() {
        return "IndexOptions{" +
                "depth=" + depth +
                ", maxNodes=" + maxNodes +
                ", textLimit=" + textLimit +
                ", searchLimit=" + searchLimit +
                '}';
    }
}
