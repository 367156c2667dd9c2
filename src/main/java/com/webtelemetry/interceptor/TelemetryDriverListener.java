package com.webtelemetry.interceptor;

import com.webtelemetry.core.BrowserTelemetrySession;
import com.webtelemetry.model.EventType;
import com.webtelemetry.model.Severity;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.events.EventFiringDecorator;
import org.openqa.selenium.support.events.WebDriverListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Selenium WebDriverListener that feeds a {@link BrowserTelemetrySession}
 * without requiring any changes to existing automation code.
 *
 * ## Usage with EventFiringDecorator (Selenium 4.x)
 *
 * <pre>
 *   WebDriver rawDriver = new ChromeDriver(TelemetryChromeOptions.defaults(true));
 *   BrowserTelemetrySession session = new BrowserTelemetrySession(
 *       TelemetryConfig.fromEnvironment(), new SeleniumPerformanceProbe(rawDriver));
 *   TelemetryDriverListener listener = new TelemetryDriverListener(session);
 *
 *   WebDriver driver = listener.decorate(rawDriver);
 *   // Navigation, clicks, typing and driver errors are now recorded
 * </pre>
 *
 * After every navigation the browser and performance logs are harvested before
 * the navigation itself is recorded, so the console and network activity of the
 * page load lands in the session ahead of the performance snapshot.
 */
public class TelemetryDriverListener implements WebDriverListener {

    private static final Logger log = LoggerFactory.getLogger(TelemetryDriverListener.class);

    private final BrowserTelemetrySession session;
    private final BrowserLogHarvester harvester;
    private volatile WebDriver driver;

    public TelemetryDriverListener(BrowserTelemetrySession session) {
        this(session, new BrowserLogHarvester(session));
    }

    public TelemetryDriverListener(BrowserTelemetrySession session, BrowserLogHarvester harvester) {
        this.session = session;
        this.harvester = harvester;
    }

    /** Wraps the raw driver so this listener sees every call. */
    public WebDriver decorate(WebDriver rawDriver) {
        this.driver = rawDriver;
        return new EventFiringDecorator<>(this).decorate(rawDriver);
    }

    // ── Navigation ────────────────────────────────────────────────────────────

    @Override
    public void afterGet(WebDriver driver, String url) {
        this.driver = driver;
        harvest(driver);
        session.onNavigation(url);
    }

    /** Navigation callbacks carry no driver; the one seen by decorate or afterGet is harvested. */
    @Override
    public void afterTo(WebDriver.Navigation navigation, String url) {
        WebDriver current = driver;
        if (current != null) {
            harvest(current);
        }
        session.onNavigation(url);
    }

    @Override
    public void afterBack(WebDriver.Navigation navigation) {
        session.onInteraction("back", null);
    }

    @Override
    public void afterRefresh(WebDriver.Navigation navigation) {
        session.onInteraction("refresh", null);
    }

    // ── Interaction ───────────────────────────────────────────────────────────

    @Override
    public void beforeClick(WebElement element) {
        session.onInteraction("click", describeElement(element));
    }

    @Override
    public void beforeSendKeys(WebElement element, CharSequence... keysToSend) {
        session.onInteraction("type", describeElement(element));
    }

    @Override
    public void beforeQuit(WebDriver driver) {
        harvest(driver);
        harvester.flushPendingResponses();
    }

    // ── Exception Interception ─────────────────────────────────────────────────

    @Override
    public void onError(Object target, Method method, Object[] args, InvocationTargetException e) {
        Throwable cause = e.getCause();
        if (cause == null) return;

        // Only Selenium-level exceptions, not application-level assertions
        if (!cause.getClass().getPackageName().startsWith("org.openqa.selenium")) {
            return;
        }

        log.info("TelemetryDriverListener: Intercepted {} on method {}", cause.getClass().getSimpleName(), method.getName());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exception", cause.getClass().getSimpleName());
        data.put("method", method.getName());
        data.put("message", firstLine(cause.getMessage()));
        session.record(EventType.ERROR, "webdriver", data, Severity.ERROR);
    }

    // ── Public API ─────────────────────────────────────────────────────────────

    /**
     * Harvests browser and performance logs now. Safe to call from test code at
     * any point, e.g. before asserting on network analysis.
     */
    public int harvest(WebDriver driver) {
        try {
            return harvester.harvest(driver);
        } catch (RuntimeException e) {
            log.warn("TelemetryDriverListener: Log harvest failed: {}", e.getMessage());
            return 0;
        }
    }

    public BrowserTelemetrySession getSession() {
        return session;
    }

    public BrowserLogHarvester getHarvester() {
        return harvester;
    }

    // ── Private Helpers ───────────────────────────────────────────────────────

    private String describeElement(WebElement element) {
        try { return element.getTagName() + "[" + element.getAttribute("id") + "]"; }
        catch (Exception e) { return "element"; }
    }

    private static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return nl >= 0 ? message.substring(0, nl) : message;
    }
}
