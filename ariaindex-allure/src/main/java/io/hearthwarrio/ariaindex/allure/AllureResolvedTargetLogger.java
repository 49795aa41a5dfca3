package io.hearthwarrio.ariaindex.allure;

import io.hearthwarrio.ariaindex.core.RefTarget;
import io.hearthwarrio.ariaindex.webdriver.ResolvedTargetLogger;
import io.hearthwarrio.ariaindex.webdriver.TargetLogDetail;
import io.hearthwarrio.ariaindex.webdriver.TargetOrigin;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for resolved targets.
 * <p>
 * Lives in ariaindex-allure to avoid leaking Allure dependency into core/webdriver.
 */
public final class AllureResolvedTargetLogger implements ResolvedTargetLogger {

    private final WebDriver driver;
    private final TargetLogDetail detail;
    private final boolean attachScreenshot;

    public AllureResolvedTargetLogger(WebDriver driver, TargetLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? TargetLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public TargetLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedTarget(String description, RefTarget target, String locator, long generation, WebElement element) {
        String title = "Ariaindex: " + safe(description) + (target == null ? "" : " – " + target.getRole());

        Allure.step(title, () -> {
            byte[] txt = describe(detail, description, target, locator, generation).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    "Resolved target",
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    static String describe(TargetLogDetail detail, String description, RefTarget target, String locator, long generation) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("target: ").append(safe(description)).append('\n')
                .append("origin: ").append(TargetOrigin.of(description)).append('\n');

        if (detail == TargetLogDetail.NONE) {
            return sb.toString();
        }
        sb.append("locator: ").append(nullSafe(locator)).append('\n');

        if (detail == TargetLogDetail.FULL) {
            if (target != null) {
                sb.append("role: ").append(target.getRole()).append('\n')
                        .append("name: ").append(nullSafe(target.getName())).append('\n')
                        .append("nth: ").append(target.getNth()).append('\n')
                        .append("selector: ").append(target.selector()).append('\n');
            }
            if (generation > 0) {
                sb.append("generation: ").append(generation).append('\n');
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
