package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.RefTarget;
import org.openqa.selenium.WebElement;

/**
 * Receives every target the driver facade resolves to an element.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface ResolvedTargetLogger {

    /**
     * Called after a target is resolved.
     *
     * @param description what the caller passed: {@code @eN}, a path or a CSS selector
     * @param target      role target behind a ref or path; {@code null} for CSS selectors and view paths
     * @param locator     locator that found the element
     * @param generation  ref map generation used; 0 when no ref map was involved
     * @param element     resolved element
     */
    void logResolvedTarget(String description, RefTarget target, String locator, long generation, WebElement element);

    default TargetLogDetail detail() {
        return TargetLogDetail.FULL;
    }
}
