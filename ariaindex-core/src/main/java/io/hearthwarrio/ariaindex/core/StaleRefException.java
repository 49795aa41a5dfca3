package io.hearthwarrio.ariaindex.core;

/**
 * Thrown when a ref is resolved against a ref map generation that has since been replaced.
 */
public class StaleRefException extends AriaIndexException {

    private final String refId;
    private final long expectedGeneration;
    private final long currentGeneration;

    public StaleRefException(String refId, long expectedGeneration, long currentGeneration) {
        super("Ref " + refId + " belongs to snapshot generation " + expectedGeneration +
                " but the current generation is " + currentGeneration);
        this.refId = refId;
        this.expectedGeneration = expectedGeneration;
        this.currentGeneration = currentGeneration;
    }

    public String getRefId() {
        return refId;
    }

    public long getExpectedGeneration() {
        return expectedGeneration;
    }

    public long getCurrentGeneration() {
        return currentGeneration;
    }
}
