package com.webtelemetry.interceptor;

import com.webtelemetry.core.BrowserTelemetrySession;
import com.webtelemetry.core.TelemetryConfig;
import com.webtelemetry.model.BrowserEvent;
import com.webtelemetry.model.EventType;
import com.webtelemetry.model.Severity;
import com.webtelemetry.support.ManualClock;
import com.webtelemetry.support.RecordingDiagnostics;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeOptions;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the driver listener callbacks and the Chrome capture options.
 * The driver is a proxy whose log access fails, as on drivers without log support.
 */
public class TelemetryDriverListenerTest {

    private BrowserTelemetrySession session;
    private TelemetryDriverListener listener;
    private WebDriver driver;

    @BeforeMethod
    public void setUp() {
        session  = new BrowserTelemetrySession(TelemetryConfig.defaults(), null,
            new ManualClock(), new RecordingDiagnostics());
        listener = new TelemetryDriverListener(session);
        driver   = (WebDriver) Proxy.newProxyInstance(getClass().getClassLoader(),
            new Class<?>[] { WebDriver.class },
            (proxy, method, args) -> { throw new WebDriverException("no logs"); });
    }

    @Test
    public void afterGet_recordsNavigationEvenWhenLogsAreUnavailable() {
        listener.afterGet(driver, "https://shop.com/");

        assertThat(session.getEventLog().ofType(EventType.NAVIGATION))
            .extracting(e -> e.getData().get("url"))
            .containsExactly("https://shop.com/");
    }

    @Test
    public void navigateTo_harvestsTheKnownDriverBeforeRecording() {
        List<WebDriver> harvested = new ArrayList<>();
        BrowserLogHarvester harvester = new BrowserLogHarvester(session) {
            @Override
            public synchronized int harvest(WebDriver target) {
                harvested.add(target);
                return 0;
            }
        };
        TelemetryDriverListener navigating = new TelemetryDriverListener(session, harvester);

        navigating.afterTo(null, "https://shop.com/early");
        assertThat(harvested).as("no driver known yet").isEmpty();

        navigating.afterGet(driver, "https://shop.com/");
        navigating.afterTo(null, "https://shop.com/cart");

        assertThat(harvested).hasSize(2).allSatisfy(d -> assertThat(d).isSameAs(driver));
        assertThat(session.getEventLog().ofType(EventType.NAVIGATION))
            .extracting(e -> e.getData().get("url"))
            .containsExactly("https://shop.com/early", "https://shop.com/", "https://shop.com/cart");
    }

    @Test
    public void navigationCallbacks_becomeInteractions() {
        listener.afterBack(null);
        listener.afterRefresh(null);

        assertThat(session.getEventLog().ofType(EventType.INTERACTION))
            .extracting(e -> e.getData().get("action"))
            .containsExactly("back", "refresh");
    }

    @Test
    public void seleniumError_isRecordedAsWebdriverEvent() throws NoSuchMethodException {
        Method findElement = WebDriver.class.getMethod("findElement", By.class);
        listener.onError(driver, findElement, new Object[] { By.id("buy") },
            new InvocationTargetException(new NoSuchElementException("no such element: #buy\nBuild info: x")));

        List<BrowserEvent> errors = session.getEventLog().ofType(EventType.ERROR);
        assertThat(errors).hasSize(1);
        BrowserEvent event = errors.get(0);
        assertThat(event.getSource()).isEqualTo("webdriver");
        assertThat(event.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(event.getData())
            .containsEntry("exception", "NoSuchElementException")
            .containsEntry("method", "findElement");
        assertThat((String) event.getData().get("message")).doesNotContain("Build info");
    }

    @Test
    public void applicationError_isIgnored() throws NoSuchMethodException {
        Method get = WebDriver.class.getMethod("get", String.class);
        listener.onError(driver, get, new Object[] { "x" },
            new InvocationTargetException(new IllegalStateException("not selenium")));

        assertThat(session.getEventLog().ofType(EventType.ERROR)).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void chromeOptions_requestBrowserAndPerformanceLogs() {
        ChromeOptions options = TelemetryChromeOptions.defaults(true);
        Map<String, Object> prefs = (Map<String, Object>) options.getCapability(TelemetryChromeOptions.LOGGING_PREFS);

        assertThat(prefs).containsEntry("browser", "ALL").containsEntry("performance", "ALL");

        Map<String, Object> browserOnly = (Map<String, Object>) TelemetryChromeOptions
            .enableLogCapture(new ChromeOptions(), false)
            .getCapability(TelemetryChromeOptions.LOGGING_PREFS);
        assertThat(browserOnly).containsOnlyKeys("browser");
    }
}
