package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.IndexOptions;
import io.hearthwarrio.ariaindex.core.PathNotFoundException;
import io.hearthwarrio.ariaindex.core.RefTarget;
import io.hearthwarrio.ariaindex.core.SearchMode;
import io.hearthwarrio.ariaindex.core.SnapshotOptions;
import io.hearthwarrio.ariaindex.core.StaleRefException;
import io.hearthwarrio.ariaindex.core.UnknownRefException;
import io.hearthwarrio.ariaindex.core.multiview.MultiViewData;
import io.hearthwarrio.ariaindex.core.multiview.MultiViewIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class AriaIndexWebDriverTest {

    private static final String PAGE = String.join("\n",
            "- navigation \"Main\":",
            "  - link \"Home\"",
            "  - link \"Docs\"",
            "- main:",
            "  - heading \"Welcome\" [level=1]",
            "  - button \"Save\"",
            "  - button \"Save\"",
            "  - text: Plain words"
    );

    private WebDriver driver;
    private WebElement element;
    private AtomicInteger captures;
    private AriaIndexWebDriver ariaIndex;

    @BeforeEach
    void setUp() {
        driver = mock(WebDriver.class);
        element = mock(WebElement.class);
        captures = new AtomicInteger();
        when(driver.findElements(any(By.class))).thenReturn(List.of(element));
        ariaIndex = new AriaIndexWebDriver(driver).withSnapshotSource((d, scope) -> {
            captures.incrementAndGet();
            return PAGE;
        });
    }

    private static By byRole(String role, String name, Integer nth) {
        return argThat(by -> by instanceof ByAriaRole && ((ByAriaRole) by).getTarget().equals(new RefTarget(role, name, nth)));
    }

    @Test
    void snapshotPublishesNewGenerationEachTime() {
        PageSnapshot first = ariaIndex.snapshot();
        PageSnapshot second = ariaIndex.snapshot(SnapshotOptions.defaults().withInteractiveOnly(true));

        assertEquals(1, first.getGeneration());
        assertEquals(2, second.getGeneration());
        assertTrue(first.getText().contains("- button \"Save\" [ref=@e5]"));
        assertEquals(new RefTarget("button", "Save", 1), second.getRefs().get("@e4"));
        assertEquals(2, ariaIndex.getRefRegistry().generation());
    }

    @Test
    void locateResolvesRefThroughRoleLocator() {
        ariaIndex.snapshot();

        assertSame(element, ariaIndex.locate("@e6"));

        verify(driver).findElements(byRole("button", "Save", 1));
    }

    @Test
    void locateWithOldGenerationIsStale() {
        long generation = ariaIndex.snapshot().getGeneration();
        ariaIndex.snapshot();

        StaleRefException e = assertThrows(StaleRefException.class, () -> ariaIndex.locate("@e2", generation));
        assertEquals("e2", e.getRefId());
    }

    @Test
    void unknownRefFails() {
        ariaIndex.snapshot();

        assertThrows(UnknownRefException.class, () -> ariaIndex.locate("@e99"));
    }

    @Test
    void locateTreatsNonRefAsCss() {
        assertSame(element, ariaIndex.locate("#save"));

        verify(driver).findElements(By.cssSelector("#save"));
    }

    @Test
    void missingElementIsReported() {
        when(driver.findElements(any(By.class))).thenReturn(List.of());
        ariaIndex.snapshot();

        TargetResolutionException e = assertThrows(TargetResolutionException.class, () -> ariaIndex.locate("@e2"));
        assertTrue(e.getMessage().contains("@e2"));
    }

    @Test
    void consistencyCheckRejectsAmbiguousMatches() {
        when(driver.findElements(any(By.class))).thenReturn(List.of(element, mock(WebElement.class)));
        ariaIndex.snapshot();

        assertSame(element, ariaIndex.locate("@e2"));

        ariaIndex.withConsistencyCheck(true);
        assertThrows(TargetResolutionException.class, () -> ariaIndex.locate("@e2"));
    }

    @Test
    void pathsResolveAgainstTheListingThatProducedThem() {
        String listing = ariaIndex.index(null);
        assertTrue(listing.contains("[path=1]"));

        ariaIndex.locatePath("1/3");

        assertEquals(1, captures.get());
        verify(driver).findElements(byRole("main", null, null));
    }

    @Test
    void scopedIndexReusesLastParse() {
        ariaIndex.index(null);
        String scoped = ariaIndex.index("1", 1, 200, 80);

        assertEquals(1, captures.get());
        assertTrue(scoped.startsWith("index (path=1, depth=1, max_nodes=200)"));
    }

    @Test
    void searchReadsFreshCapture() {
        ariaIndex.search("save", SearchMode.FUZZY);
        String result = ariaIndex.search("save", SearchMode.FUZZY, 1, 80);

        assertEquals(2, captures.get());
        assertEquals("search (query=\"save\", mode=fuzzy, limit=1)\n- button \"Save\" [path=1/1]", result);
    }

    @Test
    void locatePathWithoutPriorIndexCapturesOnce() {
        ariaIndex.locatePath("0/1");

        assertEquals(1, captures.get());
        verify(driver).findElements(byRole("link", "Docs", null));
    }

    @Test
    void viewPathsResolveThroughLastMultiViewIndex() {
        MultiViewData data = new MultiViewData("t", "", List.of(), List.of(),
                List.of(new MultiViewData.Control("button", "Buy", "#buy")), List.of());
        MultiViewCollector collector = mock(MultiViewCollector.class);
        when(collector.collect(eq(driver), any(IndexOptions.class))).thenReturn(data);
        ariaIndex.withMultiViewCollector(collector);

        assertThrows(PathNotFoundException.class, () -> ariaIndex.locatePath("v:interact/i0"));

        MultiViewIndex index = ariaIndex.multiViewIndex(null);
        assertTrue(index.getText().contains("- button \"Buy\" [path=v:interact/i0]"));
        assertSame(element, ariaIndex.locatePath("v:interact/i0"));
        verify(driver).findElements(By.cssSelector("#buy"));
    }

    @Test
    void loggerReceivesEveryResolution() {
        List<String> logged = new ArrayList<>();
        ariaIndex.withLogger((description, target, locator, generation, el) ->
                logged.add(description + "|" + (target == null ? "-" : target.getRole()) + "|" + generation));
        ariaIndex.snapshot();

        ariaIndex.at("@e1").click();
        ariaIndex.locate("#x");

        assertEquals(List.of("@e1|navigation|1", "#x|-|0"), logged);
        verify(element).click();
    }

    @Test
    void singleTargetActionResolvesOnce() {
        ariaIndex.snapshot();

        SingleTargetAction action = ariaIndex.at("@e3");
        action.click().send("abc");
        action.element();

        verify(driver, times(1)).findElements(any(By.class));
        verify(element).sendKeys("abc");
    }

    @Test
    void namedTextPathIsLocatedByItsText() {
        ariaIndex.withSnapshotSource((d, scope) -> "- paragraph:\n  - text \"Terms\"");

        assertSame(element, ariaIndex.locatePath("0/0"));

        verify(driver).findElements(byRole("text", "Terms", null));
    }
}
