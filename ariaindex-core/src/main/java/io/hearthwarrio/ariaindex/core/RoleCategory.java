package io.hearthwarrio.ariaindex.core;

import java.util.Locale;
import java.util.Set;

/**
 * Three-way role classification used by ref assignment and filtering.
 * Roles outside the three known sets (e.g. {@code text}, {@code img}, {@code paragraph}) are {@link #OTHER}.
 */
public enum RoleCategory {
    INTERACTIVE,
    CONTENT,
    STRUCTURAL,
    OTHER;

    static final Set<String> INTERACTIVE_ROLES = Set.of(
            "button", "link", "textbox", "checkbox", "radio", "combobox",
            "listbox", "menuitem", "menuitemcheckbox", "menuitemradio",
            "option", "searchbox", "slider", "spinbutton", "switch",
            "tab", "treeitem"
    );

    static final Set<String> CONTENT_ROLES = Set.of(
            "heading", "cell", "gridcell", "columnheader", "rowheader",
            "listitem", "article", "region", "main", "navigation"
    );

    static final Set<String> STRUCTURAL_ROLES = Set.of(
            "generic", "group", "list", "table", "row", "rowgroup",
            "grid", "treegrid", "menu", "menubar", "toolbar", "tablist",
            "tree", "directory", "document", "application", "presentation", "none"
    );

    public static RoleCategory of(String role) {
        if (role == null) {
            return OTHER;
        }
        String r = role.toLowerCase(Locale.ROOT);
        if (INTERACTIVE_ROLES.contains(r)) {
            return INTERACTIVE;
        }
        if (CONTENT_ROLES.contains(r)) {
            return CONTENT;
        }
        if (STRUCTURAL_ROLES.contains(r)) {
            return STRUCTURAL;
        }
        return OTHER;
    }

    /**
     * A node gets a ref iff it is interactive, or content with a name.
     */
    public static boolean deservesRef(String role, boolean named) {
        RoleCategory category = of(role);
        return category == INTERACTIVE || (category == CONTENT && named);
    }
}
