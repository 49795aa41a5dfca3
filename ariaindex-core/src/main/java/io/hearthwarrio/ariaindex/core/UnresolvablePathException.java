package io.hearthwarrio.ariaindex.core;

/**
 * Thrown when a path points to an anonymous text node and no ancestor carries a name or a non-text role,
 * so the node cannot be targeted individually.
 */
public class UnresolvablePathException extends AriaIndexException {

    private final String path;

    public UnresolvablePathException(String path) {
        super("Path points to a text node without a locatable name: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
