package io.hearthwarrio.ariaindex.core;

/**
 * Thrown when a ref id is not present in the current ref map.
 */
public class UnknownRefException extends AriaIndexException {

    private final String refId;

    public UnknownRefException(String refId) {
        super("Unknown ref: " + refId + " (take a new snapshot to get current refs)");
        this.refId = refId;
    }

    public String getRefId() {
        return refId;
    }
}
