package io.hearthwarrio.ariaindex.webdriver;

import io.hearthwarrio.ariaindex.core.RefTarget;
import org.openqa.selenium.WebElement;

import java.util.Objects;

/**
 * Default stdout logger for resolved targets.
 * <p>
 * Adds an "origin" marker: {@code ref}, {@code path} or {@code css}, depending on what the caller passed.
 */
public final class StdOutResolvedTargetLogger implements ResolvedTargetLogger {

    private final TargetLogDetail detail;

    public StdOutResolvedTargetLogger(TargetLogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public TargetLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedTarget(String description, RefTarget target, String locator, long generation, WebElement element) {
        System.out.println(format(detail, description, target, locator, generation, element));
    }

    static String format(
            TargetLogDetail detail,
            String description,
            RefTarget target,
            String locator,
            long generation,
            WebElement element
    ) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[Ariaindex] target='").append(safe(description)).append('\'')
                .append(", origin=").append(TargetOrigin.of(description));

        if (detail == TargetLogDetail.NONE) {
            return sb.toString();
        }

        sb.append(", locator=").append(nullSafe(locator));

        if (detail == TargetLogDetail.FULL) {
            if (target != null) {
                sb.append(", role=").append(target.getRole())
                        .append(", name=").append(nullSafe(target.getName()))
                        .append(", nth=").append(target.getNth());
            }
            if (generation > 0) {
                sb.append(", generation=").append(generation);
            }
            if (element != null) {
                sb.append(", tag=").append(nullSafe(element.getTagName()));
            }
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private static String nullSafe(String s) {
        return s == null ? "null" : s;
    }
}
