package com.webtelemetry.performance;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

import java.util.Map;

/**
 * Reads Navigation Timing, Paint Timing, layout-shift and heap figures from the
 * current page through {@link JavascriptExecutor}.
 *
 * Figures the browser cannot provide come back as null; a measured zero stays zero.
 */
public class SeleniumPerformanceProbe implements PerformanceProbe {

    static final String SNAPSHOT_SCRIPT =
        "const nav = performance.getEntriesByType('navigation')[0];" +
        "const paint = performance.getEntriesByType('paint');" +
        "const fp = paint.find(p => p.name === 'first-paint');" +
        "const fcp = paint.find(p => p.name === 'first-contentful-paint');" +
        "const lcpEntries = performance.getEntriesByType('largest-contentful-paint');" +
        "const lcp = lcpEntries.length ? lcpEntries[lcpEntries.length - 1] : null;" +
        "const shifts = performance.getEntriesByType('layout-shift');" +
        "return {" +
        "  pageLoadTime: nav && nav.loadEventEnd > 0 ? nav.loadEventEnd - nav.fetchStart : null," +
        "  domContentLoaded: nav && nav.domContentLoadedEventEnd > 0 ? nav.domContentLoadedEventEnd - nav.fetchStart : null," +
        "  firstPaint: fp ? fp.startTime : null," +
        "  firstContentfulPaint: fcp ? fcp.startTime : null," +
        "  largestContentfulPaint: lcp ? lcp.startTime : null," +
        "  cumulativeLayoutShift: shifts.reduce((sum, e) => e.hadRecentInput ? sum : sum + e.value, 0)," +
        "  memoryUsage: performance.memory ? {" +
        "    usedJSHeapSize: performance.memory.usedJSHeapSize," +
        "    totalJSHeapSize: performance.memory.totalJSHeapSize," +
        "    jsHeapSizeLimit: performance.memory.jsHeapSizeLimit" +
        "  } : null," +
        "  resourceCount: performance.getEntriesByType('resource').length" +
        "};";

    private final WebDriver driver;

    public SeleniumPerformanceProbe(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> collect() {
        if (!(driver instanceof JavascriptExecutor js)) {
            throw new UnsupportedOperationException(
                "Driver does not support JavaScript execution: " + driver.getClass().getSimpleName());
        }
        Object result = js.executeScript(SNAPSHOT_SCRIPT);
        return result instanceof Map ? (Map<String, Object>) result : null;
    }
}
