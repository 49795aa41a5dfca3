package io.hearthwarrio.ariaindex.core;

/**
 * Base type for failures reported by the snapshot index engine.
 */
public class AriaIndexException extends RuntimeException {
    public AriaIndexException(String message) {
        super(message);
    }

    public AriaIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
