package io.hearthwarrio.ariaindex.core.multiview;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rendered multi-view listing plus the CSS selector behind every {@code v:...} path it shows.
 */
public final class MultiViewIndex {

    private final String text;
    private final Map<String, String> viewPaths;

    MultiViewIndex(String text, Map<String, String> viewPaths) {
        this.text = text;
        this.viewPaths = Collections.unmodifiableMap(new LinkedHashMap<>(viewPaths));
    }

    public String getText() {
        return text;
    }

    /**
     * View path (e.g. {@code v:interact/i3}) to CSS selector.
     */
    public Map<String, String> getViewPaths() {
        return viewPaths;
    }

    @Override
    public String toString() {
        return text;
    }
}
