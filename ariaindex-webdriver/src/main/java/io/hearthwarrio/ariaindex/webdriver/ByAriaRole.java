package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.NodeText;
import io.hearthwarrio.ariaindex.core.RefTarget;
import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Locates elements by computed ARIA role and exact accessible name, then picks the {@code nth} match.
 * <p>
 * Candidates are pre-filtered with a CSS selector for the role (native tags with that implicit role plus
 * {@code [role=...]}), then checked with {@link WebElement#getAriaRole()} and {@link WebElement#getAccessibleName()}.
 * Hidden elements are skipped, the same way they are left out of snapshots. Names are compared after collapsing
 * whitespace and replacing double quotes with apostrophes, matching how names appear in a dump.
 * <p>
 * Named {@code text} targets have no ARIA role to compute; they match the innermost visible elements whose
 * text equals the name.
 */
public class ByAriaRole extends By {

    private static final Map<String, String> NATIVE_TAGS = Map.ofEntries(
            Map.entry("button", "button, input[type='submit'], input[type='button'], input[type='reset'], input[type='image']"),
            Map.entry("link", "a[href], area[href]"),
            Map.entry("textbox", "input:not([type]), input[type='text'], input[type='email'], input[type='password'], "
                    + "input[type='tel'], input[type='url'], textarea"),
            Map.entry("searchbox", "input[type='search']"),
            Map.entry("checkbox", "input[type='checkbox']"),
            Map.entry("radio", "input[type='radio']"),
            Map.entry("combobox", "select"),
            Map.entry("listbox", "select"),
            Map.entry("option", "option"),
            Map.entry("heading", "h1, h2, h3, h4, h5, h6"),
            Map.entry("list", "ul, ol, menu"),
            Map.entry("listitem", "li"),
            Map.entry("navigation", "nav"),
            Map.entry("main", "main"),
            Map.entry("banner", "header"),
            Map.entry("contentinfo", "footer"),
            Map.entry("complementary", "aside"),
            Map.entry("form", "form"),
            Map.entry("table", "table"),
            Map.entry("row", "tr"),
            Map.entry("cell", "td"),
            Map.entry("columnheader", "th"),
            Map.entry("img", "img"),
            Map.entry("dialog", "dialog"),
            Map.entry("paragraph", "p"),
            Map.entry("article", "article"),
            Map.entry("region", "section"),
            Map.entry("slider", "input[type='range']"),
            Map.entry("spinbutton", "input[type='number']"),
            Map.entry("generic", "div, span")
    );

    private static final String TEXT_CANDIDATES = "body *:not(script):not(style):not(noscript):not(template)";
    private static final String GENERIC_ROLE = "generic";

    private final RefTarget target;

    public ByAriaRole(RefTarget target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public RefTarget getTarget() {
        return target;
    }

    @Override
    public List<WebElement> findElements(SearchContext context) {
        List<WebElement> matches = isTextTarget() ? textMatches(context) : roleMatches(context);

        Integer nth = target.getNth();
        if (nth == null) {
            return matches;
        }
        if (nth < matches.size()) {
            return Collections.singletonList(matches.get(nth));
        }
        return Collections.emptyList();
    }

    private boolean isTextTarget() {
        return NodeText.TEXT_ROLE.equals(target.getRole());
    }

    private List<WebElement> roleMatches(SearchContext context) {
        List<WebElement> matches = new ArrayList<>();
        for (WebElement candidate : context.findElements(By.cssSelector(candidateSelector(target.getRole())))) {
            if (matches(candidate)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    /**
     * Visible elements whose text equals the name, skipping ancestors of an element that already matches.
     */
    private List<WebElement> textMatches(SearchContext context) {
        List<WebElement> matches = new ArrayList<>();
        if (!target.hasName()) {
            return matches;
        }
        String expected = normalizeName(target.getName());
        for (WebElement candidate : context.findElements(By.cssSelector(TEXT_CANDIDATES))) {
            if (hasText(candidate, expected) && !hasChildWithText(candidate, expected)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    private static boolean hasText(WebElement element, String expected) {
        return element.isDisplayed() && expected.equals(normalizeName(element.getText()));
    }

    private static boolean hasChildWithText(WebElement element, String expected) {
        for (WebElement child : element.findElements(By.xpath("./*"))) {
            if (hasText(child, expected)) {
                return true;
            }
        }
        return false;
    }

    static String candidateSelector(String role) {
        if (NodeText.TEXT_ROLE.equals(role)) {
            return TEXT_CANDIDATES;
        }
        String roleAttr = "[role='" + role.replace("'", "\\'") + "']";
        String tags = NATIVE_TAGS.get(role);
        return tags == null ? roleAttr : tags + ", " + roleAttr;
    }

    static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return name.replaceAll("\\s+", " ").trim().replace('"', '\'');
    }

    private boolean matches(WebElement candidate) {
        if (!candidate.isDisplayed()) {
            return false;
        }
        String role = candidate.getAriaRole();
        if (role == null || role.isEmpty()) {
            // browsers report plain div/span as either "generic" or no role at all
            role = GENERIC_ROLE;
        }
        if (!target.getRole().equals(role.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (!target.hasName()) {
            return true;
        }
        return normalizeName(target.getName()).equals(normalizeName(candidate.getAccessibleName()));
    }

    @Override
    public String toString() {
        String base = (isTextTarget() ? "By.ariaText: " : "By.ariaRole: ") + target.selector();
        return target.getNth() == null ? base : base + ".nth(" + target.getNth() + ")";
    }
}
