package com.webtelemetry.interceptor;

import org.openqa.selenium.chrome.ChromeOptions;

import java.util.Map;

/**
 * Chrome settings required for telemetry capture.
 *
 * Chrome only exposes the browser and performance logs that
 * {@link BrowserLogHarvester} reads when {@code goog:loggingPrefs} asks for them.
 */
public final class TelemetryChromeOptions {

    public static final String LOGGING_PREFS = "goog:loggingPrefs";

    private TelemetryChromeOptions() {}

    /**
     * Enables browser console capture and, when requested, DevTools network events.
     */
    public static ChromeOptions enableLogCapture(ChromeOptions options, boolean performanceLog) {
        options.setCapability(LOGGING_PREFS, performanceLog
            ? Map.of("browser", "ALL", "performance", "ALL")
            : Map.of("browser", "ALL"));
        return options;
    }

    public static ChromeOptions enableLogCapture(ChromeOptions options) {
        return enableLogCapture(options, true);
    }

    /**
     * Options suitable for unattended evaluation runs, with log capture enabled.
     */
    public static ChromeOptions defaults(boolean headless) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1440,900",
            "--disable-search-engine-choice-screen"
        );
        return enableLogCapture(options);
    }
}
