package io.hearthwarrio.ariaindex.webdriver;

import org.openqa.selenium.WebDriver;

/**
 * Produces an accessibility snapshot dump ({@code - role "name": ...} lines) for the current page.
 */
@FunctionalInterface
public interface AriaSnapshotSource {

    /**
     * @param driver           driver bound to the page
     * @param scopeCssSelector CSS selector of the subtree to dump, or {@code null} for the whole page
     * @return dump text; empty when there is nothing to show
     * @throws SnapshotCaptureException if the page cannot be read
     */
    String capture(WebDriver driver, String scopeCssSelector);
}
