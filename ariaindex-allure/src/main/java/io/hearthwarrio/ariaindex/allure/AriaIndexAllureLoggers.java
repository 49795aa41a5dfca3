package io.hearthwarrio.ariaindex.allure;

import io.hearthwarrio.ariaindex.webdriver.ResolvedTargetLogger;
import io.hearthwarrio.ariaindex.webdriver.TargetLogDetail;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Ariaindex loggers.
 */
public final class AriaIndexAllureLoggers {

    private AriaIndexAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger with full detail and without screenshots.
     */
    public static ResolvedTargetLogger resolvedTargets(WebDriver driver) {
        return new AllureResolvedTargetLogger(driver, TargetLogDetail.FULL, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static ResolvedTargetLogger resolvedTargets(WebDriver driver, TargetLogDetail detail, boolean screenshots) {
        return new AllureResolvedTargetLogger(driver, detail, screenshots);
    }
}
