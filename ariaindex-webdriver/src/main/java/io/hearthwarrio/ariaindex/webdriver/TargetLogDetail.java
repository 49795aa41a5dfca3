package io.hearthwarrio.ariaindex.webdriver;

/**
 * Controls how much of a resolved target is logged.
 */
public enum TargetLogDetail {

    /**
     * Only the target description (ref, path or CSS selector).
     */
    NONE,

    /**
     * Description plus the locator description ({@code getByRole(...)} or the CSS selector).
     */
    SELECTOR,

    /**
     * Everything: role, name, nth, ref map generation and the element's tag.
     */
    FULL
}
