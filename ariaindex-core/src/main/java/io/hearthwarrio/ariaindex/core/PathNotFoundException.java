package io.hearthwarrio.ariaindex.core;

/**
 * Thrown when a path is absent from the current parse's path index.
 */
public class PathNotFoundException extends AriaIndexException {

    private final String path;

    public PathNotFoundException(String path) {
        super("Unknown path: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
