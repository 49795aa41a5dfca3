package io.hearthwarrio.ariaindex.allure;

import io.hearthwarrio.ariaindex.core.RefTarget;
import io.hearthwarrio.ariaindex.webdriver.TargetLogDetail;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class AllureResolvedTargetLoggerTest {

    @Test
    void fullDetailListsTargetAndGeneration() {
        String text = AllureResolvedTargetLogger.describe(
                TargetLogDetail.FULL, "@e2", new RefTarget("link", "Docs", null), "By.ariaRole: x", 4);

        assertEquals(String.join("\n",
                "target: @e2",
                "origin: ref",
                "locator: By.ariaRole: x",
                "role: link",
                "name: Docs",
                "nth: null",
                "selector: getByRole(\"link\", { name: \"Docs\", exact: true })",
                "generation: 4",
                ""), text);
    }

    @Test
    void noneDetailKeepsOnlyTarget() {
        String text = AllureResolvedTargetLogger.describe(TargetLogDetail.NONE, "#q", null, "By.cssSelector: #q", 0);

        assertEquals("target: #q\norigin: css\n", text);
    }

    @Test
    void nullDetailMeansNone() {
        assertEquals(TargetLogDetail.NONE, new AllureResolvedTargetLogger(mock(WebDriver.class), null, false).detail());
    }

    @Test
    void factoryDefaultsToFullDetail() {
        assertEquals(TargetLogDetail.FULL, AriaIndexAllureLoggers.resolvedTargets(mock(WebDriver.class)).detail());
    }
}
