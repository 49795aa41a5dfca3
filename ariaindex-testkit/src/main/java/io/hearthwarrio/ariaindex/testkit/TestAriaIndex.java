package io.hearthwarrio.ariaindex.testkit;

import io.hearthwarrio.ariaindex.webdriver.AriaIndexWebDriver;
import io.hearthwarrio.ariaindex.webdriver.TargetLogDetail;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Convenience factory methods for creating Ariaindex facades in tests. Does not depend on Allure.
 */
public final class TestAriaIndex {

    private TestAriaIndex() {
        // utility class
    }

    /**
     * Facade without logging and without consistency checks.
     */
    public static AriaIndexWebDriver plain(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new AriaIndexWebDriver(driver);
    }

    public static AriaIndexWebDriver stdout(WebDriver driver, TargetLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new AriaIndexWebDriver(driver)
                .withLoggingToStdOut(detail);
    }

    /**
     * Stdout logging plus failing on refs that match more than one element.
     */
    public static AriaIndexWebDriver stdoutWithChecks(WebDriver driver, TargetLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new AriaIndexWebDriver(driver)
                .withLoggingToStdOut(detail)
                .withConsistencyCheck(true);
    }
}
