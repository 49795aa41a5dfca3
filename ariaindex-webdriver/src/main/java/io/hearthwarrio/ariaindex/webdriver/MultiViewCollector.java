package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.IndexOptions;
import io.hearthwarrio.ariaindex.core.multiview.MultiViewData;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Gathers the four multi-view outlines (headings, text blocks, controls, overlays) from the live page.
 * <p>
 * Only visible elements are collected. Headings come from the main content root when it carries enough text,
 * otherwise from the whole document, and fall back to the document title. Text blocks are ranked by text length
 * minus link text.
 */
public class MultiViewCollector {

    /**
     * @param driver  driver bound to the page
     * @param options depth, max nodes and text limit passed to the script
     * @return collected views (empty views when the script returns nothing)
     */
    public MultiViewData collect(WebDriver driver, IndexOptions options) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new SnapshotCaptureException("Driver does not support JavaScript: " + driver.getClass().getName());
        }

        Map<String, Object> params = new HashMap<>();
        params.put("textLimit", options.getTextLimit());
        params.put("maxNodes", options.getMaxNodes());
        params.put("depth", options.getDepth());

        Object result;
        try {
            result = ((JavascriptExecutor) driver).executeScript(PageScripts.load(PageScripts.MULTI_VIEW), params);
        } catch (WebDriverException e) {
            throw new SnapshotCaptureException("Multi-view script failed", e);
        }

        if (!(result instanceof Map)) {
            return MultiViewData.empty();
        }
        return MultiViewData.fromScriptResult((Map<?, ?>) result);
    }
}
