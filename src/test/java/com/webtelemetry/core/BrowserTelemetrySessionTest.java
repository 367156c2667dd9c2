package com.webtelemetry.core;

import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.model.BrowserEvent;
import com.webtelemetry.model.ConsoleEventData;
import com.webtelemetry.model.ConsoleMessage;
import com.webtelemetry.model.EventType;
import com.webtelemetry.model.PageErrorData;
import com.webtelemetry.model.PerformanceGrade;
import com.webtelemetry.model.PerformanceMetrics;
import com.webtelemetry.model.RequestEventData;
import com.webtelemetry.model.ResponseEventData;
import com.webtelemetry.model.SessionExport;
import com.webtelemetry.model.SessionSummary;
import com.webtelemetry.model.Severity;
import com.webtelemetry.performance.PerformanceProbe;
import com.webtelemetry.support.ManualClock;
import com.webtelemetry.support.RecordingDiagnostics;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for the session facade: routing, event log, listeners, lifecycle and export.
 */
public class BrowserTelemetrySessionTest {

    private static final PerformanceProbe FIXED_PROBE = () -> Map.of(
        "pageLoadTime", 1200.0,
        "domContentLoaded", 800.0,
        "resourceCount", 14);

    private ManualClock clock;
    private RecordingDiagnostics diagnostics;
    private BrowserTelemetrySession session;

    @BeforeMethod
    public void setUp() {
        clock       = new ManualClock();
        diagnostics = new RecordingDiagnostics();
        session     = new BrowserTelemetrySession(TelemetryConfig.defaults(), FIXED_PROBE, clock, diagnostics);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Routing
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void consoleMessage_isClassifiedAndRecorded() {
        ConsoleMessage msg = session.onConsoleMessage(
            ConsoleEventData.of("error", "Uncaught TypeError: x is undefined"));

        assertThat(msg.getCategory()).isEqualTo("javascript_error");
        List<BrowserEvent> events = session.getEventLog().ofType(EventType.CONSOLE);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(events.get(0).getData()).containsEntry("category", "javascript_error");
    }

    @Test
    public void mapPayloads_areAccepted() {
        session.onConsoleMessage(Map.of("text", "hello", "level", "log"));
        String id = session.onRequest(Map.of("request_id", "r1", "url", "https://a.com/x", "method", "GET"));
        session.onResponse(id, Map.of("status", 200));

        assertThat(id).isEqualTo("r1");
        SessionSummary summary = session.getSessionSummary();
        assertThat(summary.console().total()).isEqualTo(1);
        assertThat(summary.network().totalRequests()).isEqualTo(1);
        assertThat(summary.network().statusCodes()).containsEntry(200, 1);
    }

    @Test
    public void mistypedRequestField_isDroppedAndReported() {
        Map<String, Object> request = new HashMap<>();
        request.put("request_id", "r1");
        request.put("url", "https://a.com/app.js");
        request.put("method", "GET");
        request.put("resource_type", "script");
        request.put("initiator", "parser");

        String id = session.onRequest(request);

        assertThat(id).isEqualTo("r1");
        assertThat(session.getNetworkMonitor().getPendingRequests().get(0).getInitiator()).isNull();
        assertThat(session.getNetworkMonitor().getPendingRequests().get(0).getResourceType()).isEqualTo("script");
        assertThat(diagnostics.withCode(DiagnosticCode.PAYLOAD_DECODE_FAILED)).singleElement()
            .satisfies(d -> assertThat(d.attribute("droppedFields")).isEqualTo(List.of("initiator")));
    }

    @Test
    public void mistypedResponseStatus_stillCompletesTheRequest() {
        session.onRequest(RequestEventData.of("r1", "https://a.com/x", "GET", "xhr"));
        session.onResponse("r1", Map.of("status", "200 OK", "size", 512));

        assertThat(session.getNetworkMonitor().isPending("r1")).isFalse();
        assertThat(session.getNetworkMonitor().getCompletedRequests().get(0).getSize()).isEqualTo(512L);
        assertThat(diagnostics.count(DiagnosticCode.PAYLOAD_DECODE_FAILED)).isEqualTo(1);
    }

    @Test
    public void mistypedConsoleAndPageErrorFields_keepTheMessages() {
        ConsoleMessage msg = session.onConsoleMessage(
            Map.of("text", "Uncaught TypeError: x is undefined", "level", "error", "timestamp", "later"));
        ConsoleMessage pageError = session.onPageError(
            Map.of("message", "ReferenceError: foo is not defined", "timestamp", "yesterday"));

        assertThat(msg.getCategory()).isEqualTo("javascript_error");
        assertThat(msg.getTimestamp()).isEqualTo(clock.nowSeconds());
        assertThat(pageError.getText()).isEqualTo("ReferenceError: foo is not defined");
        assertThat(session.getSessionSummary().console().total()).isEqualTo(2);
        assertThat(diagnostics.count(DiagnosticCode.PAYLOAD_DECODE_FAILED)).isEqualTo(2);
    }

    @Test
    public void pageError_countsAsConsoleErrorAndErrorEvent() {
        session.onPageError(PageErrorData.of("ReferenceError: foo is not defined"));

        assertThat(session.getSessionSummary().console().errors()).isEqualTo(1);
        assertThat(session.getEventLog().ofType(EventType.ERROR))
            .extracting(BrowserEvent::getSource).containsExactly("page");
    }

    @Test
    public void errorResponse_isRecordedAsWarningEvent() {
        session.onRequest(RequestEventData.of("r1", "https://a.com/missing", "GET", "xhr"));
        session.onResponse("r1", ResponseEventData.of(404));

        List<BrowserEvent> network = session.getEventLog().ofType(EventType.NETWORK);
        assertThat(network).extracting(BrowserEvent::getSeverity).containsExactly(Severity.INFO, Severity.WARNING);
    }

    @Test
    public void navigation_takesPerformanceSnapshot() {
        session.onNavigation("https://a.com/");

        PerformanceMetrics latest = session.getSessionSummary().performance();
        assertThat(latest).isNotNull();
        assertThat(latest.getPageLoadTime()).isEqualTo(1200.0);
        assertThat(latest.getResourceCount()).isEqualTo(14);
        assertThat(session.getEventLog().all()).extracting(BrowserEvent::getEventType)
            .containsExactly(EventType.NAVIGATION, EventType.PERFORMANCE);
    }

    @Test
    public void navigation_withoutProbeTakesNoSnapshot() {
        BrowserTelemetrySession noProbe = new BrowserTelemetrySession(
            TelemetryConfig.defaults(), null, clock, diagnostics);
        noProbe.onNavigation("https://a.com/");

        assertThat(noProbe.getSessionSummary().performance()).isNull();
        assertThat(noProbe.getPerformance().getSnapshots()).isEmpty();
    }

    @Test
    public void navigation_snapshotCanBeDisabled() {
        TelemetryConfig config = TelemetryConfig.builder().capturePerformanceOnNavigation(false).build();
        BrowserTelemetrySession quiet = new BrowserTelemetrySession(config, FIXED_PROBE, clock, diagnostics);
        quiet.onNavigation("https://a.com/");

        assertThat(quiet.getPerformance().getSnapshots()).isEmpty();
        assertThat(quiet.capturePerformance().getPageLoadTime()).isEqualTo(1200.0);
    }

    @Test
    public void record_rejectsNullType() {
        assertThatThrownBy(() -> session.record(null, "custom", Map.of(), Severity.INFO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void patternsFile_extendsBuiltIns() throws IOException {
        Path file = Files.createTempFile("patterns", ".json");
        Files.writeString(file, "[{\"name\":\"feature_flag_off\",\"regex\":\"feature flag .* disabled\"," +
            "\"category\":\"config_warning\",\"severity\":\"warning\"}]", StandardCharsets.UTF_8);
        TelemetryConfig config = TelemetryConfig.builder().patternsPath(file).build();

        BrowserTelemetrySession custom = new BrowserTelemetrySession(config, null, clock, diagnostics);
        ConsoleMessage msg = custom.onConsoleMessage(ConsoleEventData.of("warning", "feature flag checkout disabled"));

        assertThat(msg.getCategory()).isEqualTo("config_warning");
        assertThat(diagnostics.count(DiagnosticCode.PATTERN_LOAD_FAILED)).isZero();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Listeners
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void listeners_receiveOnlySubscribedTypes() {
        List<BrowserEvent> received = new ArrayList<>();
        session.addEventListener(EventType.NAVIGATION, received::add);

        session.onConsoleMessage(ConsoleEventData.of("log", "ignored"));
        session.onNavigation("https://a.com/");

        assertThat(received).extracting(BrowserEvent::getEventType).containsExactly(EventType.NAVIGATION);
    }

    @Test
    public void failingListener_doesNotBlockOthersOrIngestion() {
        List<BrowserEvent> received = new ArrayList<>();
        session.addEventListener(EventType.CONSOLE, e -> { throw new IllegalStateException("boom"); });
        session.addEventListener(EventType.CONSOLE, received::add);

        ConsoleMessage msg = session.onConsoleMessage(ConsoleEventData.of("log", "hello"));

        assertThat(msg).isNotNull();
        assertThat(received).hasSize(1);
        assertThat(session.getConsoleMonitor().size()).isEqualTo(1);
        assertThat(diagnostics.count(DiagnosticCode.LISTENER_FAILED)).isEqualTo(1);
    }

    @Test
    public void removedListener_isNoLongerCalled() {
        List<BrowserEvent> received = new ArrayList<>();
        com.webtelemetry.event.BrowserEventListener listener = received::add;
        session.addEventListener(EventType.INTERACTION, listener);

        session.onInteraction("click", "#buy");
        assertThat(session.removeEventListener(EventType.INTERACTION, listener)).isTrue();
        session.onInteraction("click", "#buy");

        assertThat(received).hasSize(1);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Lifecycle and summary
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void summary_countsEverySignal() {
        clock.advance(2.5);
        session.onConsoleMessage(ConsoleEventData.of("warning", "something odd"));
        session.onRequest(RequestEventData.of("r1", "https://a.com/x", "GET", "xhr"));
        session.onInteraction("click", "#go");

        SessionSummary summary = session.getSessionSummary();

        assertThat(summary.sessionDuration()).isCloseTo(2.5, within(1e-9));
        assertThat(summary.totalEvents()).isEqualTo(3);
        assertThat(summary.console().warnings()).isEqualTo(1);
        assertThat(summary.network().pendingRequests()).isEqualTo(1);
        assertThat(summary.monitoringActive()).isTrue();
    }

    @Test
    public void close_stopsIngestionButKeepsPendingAndFreezesDuration() {
        session.onRequest(RequestEventData.of("r1", "https://a.com/slow", "GET", "xhr"));
        clock.advance(3);
        session.close();
        session.close();
        clock.advance(10);

        assertThat(session.onRequest(RequestEventData.of("r2", "https://a.com/late", "GET", "xhr"))).isNull();
        assertThat(session.onConsoleMessage(ConsoleEventData.of("error", "late"))).isNull();
        session.onResponse("r1", ResponseEventData.of(200));

        SessionSummary summary = session.getSessionSummary();
        assertThat(summary.monitoringActive()).isFalse();
        assertThat(summary.sessionDuration()).isCloseTo(3.0, within(1e-9));
        assertThat(summary.network().pendingRequests()).isEqualTo(1);
        assertThat(summary.totalEvents()).isEqualTo(1);
        assertThat(session.isActive()).isFalse();
    }

    @Test
    public void export_matchesMonitorAnalyses() {
        session.onRequest(RequestEventData.of("r1", "https://a.com/x", "GET", "xhr").at(100.0));
        session.onResponse("r1", ResponseEventData.of(200).at(100.2));
        session.onRequest(RequestEventData.of("r2", "https://b.com/y", "GET", "script").at(100.0));
        session.onRequestFailed("r2", "net::ERR_FAILED", null);
        session.onConsoleMessage(ConsoleEventData.of("error", "Uncaught Error: nope"));
        session.onNavigation("https://a.com/");

        SessionExport export = session.exportSummary();

        assertThat(export.sessionId()).isEqualTo(session.getSessionId());
        assertThat(export.exportedAt()).isNotNull();
        assertThat(export.network().analysis().totalRequests())
            .isEqualTo(session.getNetworkMonitor().getAnalysis().totalRequests())
            .isEqualTo(2);
        assertThat(export.network().analysis().failedRequests()).isEqualTo(1);
        assertThat(export.console().analysis().errorCount()).isEqualTo(1);
        assertThat(export.performance().snapshotCount()).isEqualTo(1);
        assertThat(export.performance().analysis().pageLoadTime()).isEqualTo(1200.0);
        assertThat(export.performance().analysis().overallScore()).as("no vitals reported").isEqualTo(50.0);
        assertThat(export.performance().analysis().overallGrade()).isEqualTo(PerformanceGrade.NEEDS_IMPROVEMENT);
        assertThat(export.summary().totalEvents()).isEqualTo(session.getEventLog().totalRecorded());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Concurrency
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void concurrentIngestion_losesNothing() throws Exception {
        int threads = 8;
        int perThread = 100;
        BrowserTelemetrySession shared = new BrowserTelemetrySession(
            TelemetryConfig.builder().eventLogCapacity(10_000).build(), null, clock, diagnostics);
        List<BrowserEvent> networkEvents = new CopyOnWriteArrayList<>();
        shared.addEventListener(EventType.NETWORK, networkEvents::add);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    String id = "w" + worker + "-" + i;
                    shared.onRequest(RequestEventData.of(id, "https://a.com/" + id, "GET", "xhr"));
                    shared.onConsoleMessage(ConsoleEventData.of("log", "tick " + id));
                    shared.onResponse(id, ResponseEventData.of(200));
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        SessionSummary summary = shared.getSessionSummary();
        assertThat(summary.network().totalRequests()).isEqualTo(threads * perThread);
        assertThat(summary.network().pendingRequests()).isZero();
        assertThat(summary.console().total()).isEqualTo(threads * perThread);
        assertThat(summary.totalEvents()).isEqualTo(3L * threads * perThread);
        assertThat(networkEvents).hasSize(2 * threads * perThread);
        assertThat(diagnostics.count(DiagnosticCode.CORRELATION_MISS)).isZero();
    }
}
