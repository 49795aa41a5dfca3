package io.hearthwarrio.ariaindex.webdriver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the JavaScript bodies executed through {@code JavascriptExecutor}. Scripts are bundled next to this class.
 */
final class PageScripts {

    static final String ARIA_SNAPSHOT = "aria-snapshot.js";
    static final String MULTI_VIEW = "multiview.js";

    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private PageScripts() {
        // utility class
    }

    static String load(String name) {
        return CACHE.computeIfAbsent(name, PageScripts::read);
    }

    private static String read(String name) {
        try (InputStream in = PageScripts.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Bundled script not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bundled script " + name, e);
        }
    }
}
