package io.hearthwarrio.ariaindex.core;

/**
 * Turns raw snapshot text into a navigable {@link SnapshotTree}.
 */
public interface SnapshotParser {

    /**
     * Parses the given snapshot text.
     *
     * @param text indented snapshot dump (may be null or blank)
     * @return parsed tree with paths assigned; empty for null, blank or unparseable input
     */
    SnapshotTree parse(String text);
}
