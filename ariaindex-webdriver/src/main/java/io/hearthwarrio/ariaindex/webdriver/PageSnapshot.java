package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.RefMap;

import java.util.Objects;

/**
 * Annotated snapshot text together with the ref map generation it was published as.
 * Refs from {@link #getText()} resolve through {@link AriaIndexWebDriver#locate(String, long)} until the next
 * snapshot replaces them.
 */
public final class PageSnapshot {

    private final String text;
    private final RefMap refs;

    PageSnapshot(String text, RefMap refs) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.refs = Objects.requireNonNull(refs, "refs must not be null");
    }

    public String getText() {
        return text;
    }

    public RefMap getRefs() {
        return refs;
    }

    public long getGeneration() {
        return refs.getGeneration();
    }

    @Override
    public String toString() {
        return text;
    }
}
