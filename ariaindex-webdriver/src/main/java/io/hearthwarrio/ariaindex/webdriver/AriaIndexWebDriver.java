package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.AnnotatedSnapshot;
import io.hearthwarrio.ariaindex.core.AriaIndex;
import io.hearthwarrio.ariaindex.core.IndexOptions;
import io.hearthwarrio.ariaindex.core.PathNotFoundException;
import io.hearthwarrio.ariaindex.core.RefMap;
import io.hearthwarrio.ariaindex.core.RefRegistry;
import io.hearthwarrio.ariaindex.core.RefTarget;
import io.hearthwarrio.ariaindex.core.SearchMode;
import io.hearthwarrio.ariaindex.core.SnapshotOptions;
import io.hearthwarrio.ariaindex.core.multiview.MultiViewData;
import io.hearthwarrio.ariaindex.core.multiview.MultiViewIndex;
import io.hearthwarrio.ariaindex.core.multiview.MultiViewIndexer;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Objects;

/**
 * Ariaindex entry point for Selenium WebDriver, bound to one page.
 * <p>
 * Two kinds of handles come out of this facade:
 * <ul>
 *   <li>refs ({@code @eN}) from {@link #snapshot(SnapshotOptions)}: each snapshot publishes a new ref map generation
 *       and replaces the previous one. {@link #locate(String, long)} refuses refs from a replaced generation.</li>
 *   <li>paths ({@code 0/2/1}) from {@link #index(String)} and {@link #search(String, SearchMode)}: they resolve
 *       against the parse that produced them, i.e. the latest index or search call. Multi-view paths
 *       ({@code v:interact/i3}) resolve against the latest {@link #multiViewIndex(String)}.</li>
 * </ul>
 * Neither kind is guaranteed to still match after the page mutates; re-snapshot or re-index after navigation.
 * <p>
 * Not thread-safe apart from the ref registry; use one instance per test thread.
 */
public class AriaIndexWebDriver {

    private final WebDriver driver;
    private final RefRegistry refRegistry = new RefRegistry();
    private final MultiViewIndexer multiViewIndexer = new MultiViewIndexer();

    private AriaSnapshotSource snapshotSource = new ScriptAriaSnapshotSource();
    private MultiViewCollector multiViewCollector = new MultiViewCollector();
    private IndexOptions indexOptions = IndexOptions.defaults();
    private String scopeSelector;

    /**
     * Mutable to support runtime overrides.
     */
    private ResolvedTargetLogger resolvedTargetLogger;

    private boolean consistencyCheckEnabled = false;

    private AriaIndex lastIndex;
    private MultiViewIndex lastMultiView;

    public AriaIndexWebDriver(WebDriver driver) {
        this(driver, null);
    }

    public AriaIndexWebDriver(WebDriver driver, ResolvedTargetLogger logger) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.resolvedTargetLogger = logger;
    }

    // ----------- configuration -----------

    public AriaIndexWebDriver withLogger(ResolvedTargetLogger logger) {
        this.resolvedTargetLogger = logger;
        return this;
    }

    public AriaIndexWebDriver withLoggingToStdOut(TargetLogDetail detail) {
        this.resolvedTargetLogger = new StdOutResolvedTargetLogger(detail);
        return this;
    }

    public AriaIndexWebDriver disableLogging() {
        this.resolvedTargetLogger = null;
        return this;
    }

    public AriaIndexWebDriver withSnapshotSource(AriaSnapshotSource source) {
        this.snapshotSource = Objects.requireNonNull(source, "source must not be null");
        return this;
    }

    public AriaIndexWebDriver withMultiViewCollector(MultiViewCollector collector) {
        this.multiViewCollector = Objects.requireNonNull(collector, "collector must not be null");
        return this;
    }

    public AriaIndexWebDriver withIndexOptions(IndexOptions options) {
        this.indexOptions = Objects.requireNonNull(options, "options must not be null");
        return this;
    }

    /**
     * Restricts snapshots to the subtree matching {@code cssSelector}; {@code null} dumps the whole page.
     */
    public AriaIndexWebDriver withScope(String cssSelector) {
        this.scopeSelector = cssSelector;
        return this;
    }

    /**
     * When enabled, a ref or path whose role locator matches more than one element fails instead of silently
     * picking the first match. That happens when the page changed after the snapshot.
     */
    public AriaIndexWebDriver withConsistencyCheck(boolean enabled) {
        this.consistencyCheckEnabled = enabled;
        return this;
    }

    public boolean isConsistencyCheckEnabled() {
        return consistencyCheckEnabled;
    }

    public WebDriver getDriver() {
        return driver;
    }

    public RefRegistry getRefRegistry() {
        return refRegistry;
    }

    public IndexOptions getIndexOptions() {
        return indexOptions;
    }

    // ----------- snapshots and refs -----------

    /**
     * Captures the raw snapshot dump of the page (or the configured scope).
     */
    public String captureSnapshot() {
        String text = snapshotSource.capture(driver, scopeSelector);
        return text == null ? "" : text;
    }

    public PageSnapshot snapshot() {
        return snapshot(SnapshotOptions.defaults());
    }

    /**
     * Captures, annotates with {@code [ref=@eN]} markers and publishes the refs as a new generation.
     * Refs handed out by earlier snapshots stop resolving through {@link #locate(String, long)}.
     */
    public PageSnapshot snapshot(SnapshotOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        AnnotatedSnapshot annotated = AriaIndex.annotate(captureSnapshot(), options);
        RefMap published = refRegistry.publish(annotated.getRefs());
        return new PageSnapshot(annotated.getTree(), published);
    }

    // ----------- index and search -----------

    /**
     * Parses a fresh capture; later path lookups resolve against it.
     */
    public AriaIndex refresh() {
        AriaIndex index = AriaIndex.of(captureSnapshot(), indexOptions);
        this.lastIndex = index;
        return index;
    }

    /**
     * Index listing with the configured {@link IndexOptions}.
     * <p>
     * The root listing ({@code path == null}) always reads a fresh capture. A non-null path scopes into the parse
     * that handed it out, so it keeps meaning the same node.
     */
    public String index(String path) {
        return indexSource(path).index(path);
    }

    public String index(String path, int depth, int maxNodes, int textLimit) {
        return indexSource(path).index(path, depth, maxNodes, textLimit);
    }

    /**
     * Searches a fresh capture with the configured limits.
     */
    public String search(String query, SearchMode mode) {
        return refresh().search(query, mode);
    }

    public String search(String query, SearchMode mode, int limit, int textLimit) {
        return refresh().search(query, mode, limit, textLimit);
    }

    /**
     * Multi-view listing of a fresh collection; its {@code v:...} paths resolve through {@link #locatePath(String)}.
     */
    public MultiViewIndex multiViewIndex(String path) {
        MultiViewData data = multiViewCollector.collect(driver, indexOptions);
        MultiViewIndex index = multiViewIndexer.build(
                data, path, indexOptions.getDepth(), indexOptions.getMaxNodes(), indexOptions.getTextLimit());
        this.lastMultiView = index;
        return index;
    }

    public String multiViewSearch(String query, SearchMode mode) {
        MultiViewData data = multiViewCollector.collect(driver, indexOptions);
        return multiViewIndexer.search(data, query, mode, indexOptions.getSearchLimit(), indexOptions.getTextLimit());
    }

    private AriaIndex indexSource(String path) {
        if (path != null && lastIndex != null) {
            return lastIndex;
        }
        return refresh();
    }

    // ----------- resolution -----------

    /**
     * Resolves a ref ({@code @eN}) against the current ref map, or treats anything else as a CSS selector.
     *
     * @throws io.hearthwarrio.ariaindex.core.UnknownRefException if the ref is not in the current map
     * @throws TargetResolutionException                          if nothing on the page matches
     */
    public WebElement locate(String selectorOrRef) {
        Objects.requireNonNull(selectorOrRef, "selectorOrRef must not be null");
        if (RefMap.isRef(selectorOrRef)) {
            RefMap map = refRegistry.current();
            return resolveTarget(selectorOrRef, map.get(selectorOrRef), map.getGeneration());
        }
        return resolveCss(selectorOrRef, selectorOrRef);
    }

    /**
     * Resolves a ref only if it comes from the snapshot published as {@code generation}.
     *
     * @throws io.hearthwarrio.ariaindex.core.StaleRefException if a newer snapshot replaced that generation
     */
    public WebElement locate(String ref, long generation) {
        Objects.requireNonNull(ref, "ref must not be null");
        return resolveTarget(ref, refRegistry.resolve(ref, generation), generation);
    }

    /**
     * Resolves a tree path from the latest index/search, or a {@code v:...} path from the latest multi-view index.
     *
     * @throws PathNotFoundException if the path is unknown
     * @throws io.hearthwarrio.ariaindex.core.UnresolvablePathException if no nameable ancestor exists
     */
    public WebElement locatePath(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (TargetOrigin.of(path) == TargetOrigin.view) {
            MultiViewIndex views = lastMultiView;
            String selector = views == null ? null : views.getViewPaths().get(path);
            if (selector == null) {
                throw new PathNotFoundException(path);
            }
            return resolveCss(path, selector);
        }
        AriaIndex index = lastIndex != null ? lastIndex : refresh();
        return resolveTarget(path, index.resolvePath(path), 0L);
    }

    /**
     * Locator for a ref in the current map, for use with Selenium waits or PageFactory-style code.
     */
    public By byRef(String ref) {
        return new ByAriaRole(refRegistry.resolve(ref));
    }

    public SingleTargetAction at(String selectorOrRef) {
        return new SingleTargetAction(this, selectorOrRef, false);
    }

    public SingleTargetAction atPath(String path) {
        return new SingleTargetAction(this, path, true);
    }

    public void click(String selectorOrRef) {
        locate(selectorOrRef).click();
    }

    public void sendKeys(String selectorOrRef, CharSequence... keys) {
        locate(selectorOrRef).sendKeys(keys);
    }

    private WebElement resolveTarget(String description, RefTarget target, long generation) {
        ByAriaRole by = new ByAriaRole(target);
        List<WebElement> found = driver.findElements(by);
        if (found.isEmpty()) {
            throw new TargetResolutionException("No element matches '" + description + "' (" + by + ")");
        }
        if (consistencyCheckEnabled && found.size() > 1) {
            throw new TargetResolutionException(
                    "Target '" + description + "' is ambiguous: " + by + " matches " + found.size() +
                            " elements. The page changed since the snapshot; take a new one."
            );
        }
        WebElement element = found.get(0);
        log(description, target, by.toString(), generation, element);
        return element;
    }

    private WebElement resolveCss(String description, String cssSelector) {
        By by = By.cssSelector(cssSelector);
        List<WebElement> found = driver.findElements(by);
        if (found.isEmpty()) {
            throw new TargetResolutionException("No element matches '" + description + "' (" + by + ")");
        }
        WebElement element = found.get(0);
        log(description, null, by.toString(), 0L, element);
        return element;
    }

    private void log(String description, RefTarget target, String locator, long generation, WebElement element) {
        if (resolvedTargetLogger != null) {
            resolvedTargetLogger.logResolvedTarget(description, target, locator, generation, element);
        }
    }
}
