package io.hearthwarrio.ariaindex.webdriver;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.Objects;

/**
 * Builds the snapshot dump in the page itself.
 * <p>
 * The script walks the visible DOM, computes each element's role (explicit {@code role} attribute or the implicit
 * role of its tag) and accessible name ({@code aria-label}, {@code aria-labelledby}, {@code alt}, the associated
 * {@code label}, {@code placeholder}, content for name-from-content roles, {@code title}) and emits one line per
 * element. Elements without a role are flattened into their parent; bare text becomes {@code - text: ...}.
 * Quotes inside names are replaced with apostrophes so every line stays parseable.
 */
public final class ScriptAriaSnapshotSource implements AriaSnapshotSource {

    @Override
    public String capture(WebDriver driver, String scopeCssSelector) {
        Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new SnapshotCaptureException("Driver does not support JavaScript: " + driver.getClass().getName());
        }

        Object result;
        try {
            result = ((JavascriptExecutor) driver).executeScript(PageScripts.load(PageScripts.ARIA_SNAPSHOT), scopeCssSelector);
        } catch (WebDriverException e) {
            throw new SnapshotCaptureException("Snapshot script failed" + scopeSuffix(scopeCssSelector), e);
        }
        return result == null ? "" : String.valueOf(result);
    }

    private static String scopeSuffix(String scope) {
        return scope == null ? "" : " for scope '" + scope + "'";
    }
}
