package io.hearthwarrio.ariaindex.webdriver;

import org.openqa.selenium.WebElement;

import java.util.Objects;

/**
 * Fluent helper for interacting with a single ref, path or CSS target.
 * <p>
 * The target is resolved lazily on first use and at most once per instance; later calls reuse the same element.
 */
public final class SingleTargetAction {

    private final AriaIndexWebDriver ariaIndex;
    private final String target;
    private final boolean path;

    private WebElement cached;

    SingleTargetAction(AriaIndexWebDriver ariaIndex, String target, boolean path) {
        this.ariaIndex = Objects.requireNonNull(ariaIndex, "ariaIndex must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.path = path;
    }

    /**
     * Resolves the target and performs {@link WebElement#click()}.
     *
     * @return this helper instance for fluent chaining
     */
    public SingleTargetAction click() {
        element().click();
        return this;
    }

    /**
     * Resolves the target and performs {@link WebElement#sendKeys(CharSequence...)}.
     *
     * @param keys keys to send
     * @return this helper instance for fluent chaining
     */
    public SingleTargetAction send(CharSequence... keys) {
        element().sendKeys(keys);
        return this;
    }

    /**
     * Clears the field, then sends {@code value}.
     */
    public SingleTargetAction fill(CharSequence value) {
        WebElement element = element();
        element.clear();
        element.sendKeys(value);
        return this;
    }

    public String text() {
        return element().getText();
    }

    public WebElement element() {
        if (cached == null) {
            cached = path ? ariaIndex.locatePath(target) : ariaIndex.locate(target);
        }
        return cached;
    }
}
