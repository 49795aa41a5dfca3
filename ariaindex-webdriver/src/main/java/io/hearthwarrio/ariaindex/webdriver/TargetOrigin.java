package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.RefMap;

/**
 * What kind of target string a caller passed in.
 */
public enum TargetOrigin {
    ref, path, view, css;

    private static final String VIEW_PREFIX = "v:";

    /**
     * {@code @eN} is a ref, {@code v:...} a multi-view path, digits and slashes a tree path, anything else CSS.
     */
    public static TargetOrigin of(String description) {
        if (description == null) {
            return css;
        }
        String s = description.trim();
        if (RefMap.isRef(s)) {
            return ref;
        }
        if (s.startsWith(VIEW_PREFIX)) {
            return view;
        }
        if (!s.isEmpty() && s.matches("\\d+(/\\d+)*")) {
            return path;
        }
        return css;
    }
}
