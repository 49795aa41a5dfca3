package io.hearthwarrio.ariaindex.core;

import java.util.Objects;

/**
 * Entry point over one parsed snapshot.
 * <p>
 * Parses once and answers index, search and path resolution queries against the same tree, so paths returned by
 * {@link #index(String)} or {@link #search(String, SearchMode)} resolve against exactly the parse that produced them.
 * Instances are immutable and hold no state besides the tree.
 *
 * <pre>
 * AriaIndex index = AriaIndex.of(snapshotText);
 * String listing = index.index(null);
 * RefTarget target = index.resolvePath("0/1");
 * </pre>
 */
public final class AriaIndex {

    private final SnapshotTree tree;
    private final IndexOptions options;
    private final SnapshotIndexBuilder indexBuilder;
    private final SnapshotSearch search;
    private final PathLocatorResolver resolver;

    private AriaIndex(SnapshotTree tree, IndexOptions options) {
        this.tree = tree;
        this.options = options;
        this.indexBuilder = new SnapshotIndexBuilder();
        this.search = new SnapshotSearch();
        this.resolver = new PathLocatorResolver();
    }

    public static AriaIndex of(String snapshotText) {
        return of(snapshotText, IndexOptions.defaults());
    }

    public static AriaIndex of(String snapshotText, IndexOptions options) {
        return new AriaIndex(SnapshotTree.parse(snapshotText), Objects.requireNonNull(options, "options must not be null"));
    }

    public static AriaIndex of(SnapshotTree tree, IndexOptions options) {
        return new AriaIndex(
                Objects.requireNonNull(tree, "tree must not be null"),
                Objects.requireNonNull(options, "options must not be null")
        );
    }

    /**
     * Annotates a dump with refs. Stateless; see {@link ReferenceAssigner}.
     */
    public static AnnotatedSnapshot annotate(String snapshotText, SnapshotOptions options) {
        return new ReferenceAssigner().assignRefs(snapshotText, options);
    }

    public AriaIndex withOptions(IndexOptions options) {
        return new AriaIndex(tree, Objects.requireNonNull(options, "options must not be null"));
    }

    public SnapshotTree getTree() {
        return tree;
    }

    public IndexOptions getOptions() {
        return options;
    }

    /**
     * Index listing from {@code path} (or the roots when {@code null}) with the configured bounds.
     */
    public String index(String path) {
        return indexBuilder.buildIndex(tree, path, options);
    }

    public String index(String path, int depth, int maxNodes, int textLimit) {
        return indexBuilder.buildIndex(tree, path, depth, maxNodes, textLimit);
    }

    /**
     * Search with the configured limit and text limit.
     */
    public String search(String query, SearchMode mode) {
        return search.search(tree, query, mode, options.getSearchLimit(), options.getTextLimit());
    }

    public String search(String query, SearchMode mode, int limit, int textLimit) {
        return search.search(tree, query, mode, limit, textLimit);
    }

    public RefTarget resolvePath(String path) {
        return resolver.resolvePath(tree, path);
    }
}
