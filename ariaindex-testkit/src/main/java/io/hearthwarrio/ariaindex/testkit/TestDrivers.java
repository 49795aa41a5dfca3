package io.hearthwarrio.ariaindex.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.time.Duration;
import java.util.Objects;

/**
 * Minimal WebDriver factory for tests: local Chrome (optionally headless) or a Selenium Grid.
 */
public final class TestDrivers {
    /**
     * Implicit wait applied to every driver; ref and path lookups wait this long for late elements.
     */
    public static final Duration DEFAULT_IMPLICIT_WAIT = Duration.ofSeconds(2);

    private TestDrivers() {
        // utility class
    }

    public static WebDriver chrome() {
        return chrome(new ChromeOptions());
    }

    /**
     * Local Chrome without a window, the usual choice on CI.
     */
    public static WebDriver headlessChrome() {
        return chrome(new ChromeOptions().addArguments("--headless=new", "--window-size=1280,900"));
    }

    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        applyDefaults(driver);
        return driver;
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
    }
}
