package com.webtelemetry.core;

import com.webtelemetry.console.ConsoleMonitor;
import com.webtelemetry.console.ConsolePattern;
import com.webtelemetry.console.ConsolePatternCatalog;
import com.webtelemetry.console.ConsolePatternRepository;
import com.webtelemetry.diagnostics.Diagnostic;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.diagnostics.TelemetryDiagnostics;
import com.webtelemetry.event.BrowserEventListener;
import com.webtelemetry.event.EventLog;
import com.webtelemetry.model.BrowserEvent;
import com.webtelemetry.model.ConsoleAnalysis;
import com.webtelemetry.model.ConsoleEventData;
import com.webtelemetry.model.ConsoleMessage;
import com.webtelemetry.model.EventType;
import com.webtelemetry.model.NetworkAnalysis;
import com.webtelemetry.model.NetworkRequest;
import com.webtelemetry.model.PageErrorData;
import com.webtelemetry.model.PerformanceMetrics;
import com.webtelemetry.model.RequestEventData;
import com.webtelemetry.model.RequestFailedEventData;
import com.webtelemetry.model.ResponseEventData;
import com.webtelemetry.model.SessionExport;
import com.webtelemetry.model.SessionSummary;
import com.webtelemetry.model.Severity;
import com.webtelemetry.network.NetworkMonitor;
import com.webtelemetry.performance.PerformanceProbe;
import com.webtelemetry.performance.PerformanceSnapshotAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BrowserTelemetrySession -- the primary integration point for browser instrumentation.
 *
 * ## Ingestion
 * Instrumentation (a decorated WebDriver, a log harvester, an injected script bridge)
 * calls the {@code onXxx} methods as signals arrive. Each call is routed to the owning
 * monitor, recorded in the session {@link EventLog} and dispatched to listeners
 * subscribed to that event type.
 *
 * ## Lifecycle
 * A session is active from construction until {@link #close()}. After close, ingestion
 * calls are ignored; analysis and export remain available and still report requests
 * that never completed.
 *
 * ## Thread Safety
 * Ingestion may come from several threads. Each monitor guards its own state; the
 * event log and listener lists are concurrent collections.
 */
public class BrowserTelemetrySession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserTelemetrySession.class);

    private final String sessionId = UUID.randomUUID().toString();
    private final TelemetryConfig config;
    private final TelemetryClock clock;
    private final TelemetryDiagnostics diagnostics;
    private final boolean probeConfigured;

    private final EventLog eventLog;
    private final ConsoleMonitor consoleMonitor;
    private final NetworkMonitor networkMonitor;
    private final PerformanceSnapshotAssembler performance;
    private final Map<EventType, List<BrowserEventListener>> listeners = new EnumMap<>(EventType.class);

    private final double startTime;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private volatile Double endTime;

    public BrowserTelemetrySession() {
        this(TelemetryConfig.defaults(), null);
    }

    public BrowserTelemetrySession(TelemetryConfig config, PerformanceProbe probe) {
        this(config, probe, TelemetryClock.system(), TelemetryDiagnostics.slf4j());
    }

    public BrowserTelemetrySession(TelemetryConfig config, PerformanceProbe probe,
                                   TelemetryClock clock, TelemetryDiagnostics diagnostics) {
        this.config          = Objects.requireNonNull(config, "config");
        this.clock           = Objects.requireNonNull(clock, "clock");
        this.diagnostics     = Objects.requireNonNull(diagnostics, "diagnostics");
        this.probeConfigured = probe != null;

        List<ConsolePattern> patterns = ConsolePatternCatalog.builtIns();
        if (config.isPatternsFileEnabled()) {
            patterns = ConsolePatternCatalog.withExtras(
                new ConsolePatternRepository(config.getPatternsPath(), diagnostics).load());
        }

        this.eventLog       = new EventLog(config.getEventLogCapacity(), clock);
        this.consoleMonitor = new ConsoleMonitor(patterns, clock, diagnostics, config);
        this.networkMonitor = new NetworkMonitor(clock, diagnostics, config);
        this.performance    = new PerformanceSnapshotAssembler(probe, clock, diagnostics);
        for (EventType type : EventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
        this.startTime = clock.nowSeconds();

        log.info("BrowserTelemetrySession: started {} -- {} console patterns, probe={}, {}",
            sessionId, patterns.size(), probeConfigured ? "configured" : "none", config);
    }

    // ── Console ───────────────────────────────────────────────────────────────

    /**
     * Classifies and records a console message.
     *
     * @return the classified message, or null when the session is closed
     */
    public ConsoleMessage onConsoleMessage(ConsoleEventData data) {
        if (rejectWhenClosed("console message")) return null;
        ConsoleMessage message = consoleMonitor.addMessage(data);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", message.getText());
        payload.put("level", message.getLevel().getName());
        payload.put("category", message.getCategory());
        payload.put("severityScore", message.getSeverityScore());
        if (message.getLocation() != null) {
            payload.put("location", message.getLocation().toString());
        }
        emitEvent(EventType.CONSOLE, null, payload, Severity.fromConsoleLevel(message.getLevel()));
        return message;
    }

    public ConsoleMessage onConsoleMessage(Map<String, ?> payload) {
        if (rejectWhenClosed("console message")) return null;
        return onConsoleMessage(decode(payload, ConsoleEventData.class, "console message"));
    }

    /**
     * Records an uncaught page error as an error-level console message and an ERROR event.
     */
    public ConsoleMessage onPageError(PageErrorData data) {
        if (rejectWhenClosed("page error")) return null;
        ConsoleMessage message = consoleMonitor.addPageError(data);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message.getText());
        payload.put("category", message.getCategory());
        if (message.getStackTrace() != null) {
            payload.put("stack", message.getStackTrace());
        }
        emitEvent(EventType.ERROR, "page", payload, Severity.ERROR);
        return message;
    }

    public ConsoleMessage onPageError(Map<String, ?> payload) {
        if (rejectWhenClosed("page error")) return null;
        return onPageError(decode(payload, PageErrorData.class, "page error"));
    }

    // ── Network ───────────────────────────────────────────────────────────────

    /**
     * Registers an outgoing request.
     *
     * @return the correlation id for the response or failure, or null when the session is closed
     */
    public String onRequest(RequestEventData data) {
        if (rejectWhenClosed("request")) return null;
        String requestId = networkMonitor.addRequest(data);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", "request");
        payload.put("requestId", requestId);
        if (data != null) {
            payload.put("url", data.url());
            payload.put("method", data.method());
            payload.put("resourceType", data.resourceType());
        }
        emitEvent(EventType.NETWORK, null, payload, Severity.INFO);
        return requestId;
    }

    public String onRequest(Map<String, ?> payload) {
        if (rejectWhenClosed("request")) return null;
        return onRequest(decode(payload, RequestEventData.class, "request"));
    }

    public void onResponse(String requestId, ResponseEventData data) {
        if (rejectWhenClosed("response")) return;
        networkMonitor.addResponse(requestId, data);

        Integer status = data != null ? data.status() : null;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", "response");
        payload.put("requestId", requestId);
        payload.put("status", status);
        if (data != null && data.isCacheHit()) {
            payload.put("cacheHit", true);
        }
        Severity severity = status != null && status >= 400 ? Severity.WARNING : Severity.INFO;
        emitEvent(EventType.NETWORK, null, payload, severity);
    }

    public void onResponse(String requestId, Map<String, ?> payload) {
        if (rejectWhenClosed("response")) return;
        onResponse(requestId, decode(payload, ResponseEventData.class, "response"));
    }

    public void onRequestFailed(RequestFailedEventData data) {
        if (rejectWhenClosed("request failure")) return;
        if (data == null) return;
        networkMonitor.addRequestFailure(data);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", "failure");
        payload.put("requestId", data.requestId());
        payload.put("error", data.error());
        if (data.blockedReason() != null) {
            payload.put("blockedReason", data.blockedReason());
        }
        emitEvent(EventType.NETWORK, null, payload, Severity.ERROR);
    }

    public void onRequestFailed(String requestId, String error, String blockedReason) {
        onRequestFailed(new RequestFailedEventData(requestId, error, blockedReason, null));
    }

    // ── Navigation, interaction, performance ─────────────────────────────────

    /**
     * Records a navigation and, when enabled and a probe is configured, takes a
     * performance snapshot of the new page.
     */
    public void onNavigation(String url) {
        if (rejectWhenClosed("navigation")) return;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", url);
        emitEvent(EventType.NAVIGATION, null, payload, Severity.INFO);

        if (config.isCapturePerformanceOnNavigation() && probeConfigured) {
            capturePerformance();
        }
    }

    public void onInteraction(String action, String target) {
        if (rejectWhenClosed("interaction")) return;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        if (target != null) {
            payload.put("target", target);
        }
        emitEvent(EventType.INTERACTION, null, payload, Severity.INFO);
    }

    /**
     * Takes a performance snapshot now. Never throws; a failed probe yields a
     * snapshot with every figure absent.
     *
     * @return the snapshot, or null when the session is closed
     */
    public PerformanceMetrics capturePerformance() {
        if (rejectWhenClosed("performance snapshot")) return null;
        PerformanceMetrics metrics = performance.capture();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pageLoadTime", metrics.getPageLoadTime());
        payload.put("domContentLoaded", metrics.getDomContentLoaded());
        payload.put("firstContentfulPaint", metrics.getFirstContentfulPaint());
        payload.put("largestContentfulPaint", metrics.getLargestContentfulPaint());
        payload.put("cumulativeLayoutShift", metrics.getCumulativeLayoutShift());
        payload.put("resourceCount", metrics.getResourceCount());
        emitEvent(EventType.PERFORMANCE, null, payload, metrics.isEmpty() ? Severity.WARNING : Severity.INFO);
        return metrics;
    }

    /**
     * Records an arbitrary event without routing it to a monitor.
     *
     * @throws IllegalArgumentException when {@code type} is null
     */
    public BrowserEvent record(EventType type, String source, Map<String, ?> data, Severity severity) {
        if (type == null) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (rejectWhenClosed(type.sourceName() + " event")) return null;
        return emitEvent(type, source, data, severity);
    }

    // ── Listeners ─────────────────────────────────────────────────────────────

    /**
     * Subscribes to events of one type. Listeners run on the ingesting thread,
     * after the event has been recorded, in subscription order.
     */
    public void addEventListener(EventType type, BrowserEventListener listener) {
        listeners.get(Objects.requireNonNull(type, "type")).add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeEventListener(EventType type, BrowserEventListener listener) {
        return type != null && listeners.get(type).remove(listener);
    }

    private BrowserEvent emitEvent(EventType type, String source, Map<String, ?> data, Severity severity) {
        BrowserEvent event = eventLog.record(type, source, data, severity);
        for (BrowserEventListener listener : listeners.get(type)) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("eventType", type.name());
                attributes.put("listener", listener.getClass().getName());
                attributes.put("exception", e.getClass().getSimpleName());
                diagnostics.emit(Diagnostic.warning(DiagnosticCode.LISTENER_FAILED, "BrowserTelemetrySession",
                    "Event listener failed: " + e.getMessage(), attributes));
            }
        }
        return event;
    }

    /**
     * Binds a Map payload to its event record. Values of the wrong type are dropped
     * and reported so one malformed field never loses the whole event.
     */
    private <T> T decode(Map<String, ?> payload, Class<T> type, String what) {
        List<String> dropped = new ArrayList<>();
        T data = TelemetryPayloads.convert(payload, type, dropped::add);
        if (!dropped.isEmpty()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("event", what);
            attributes.put("droppedFields", List.copyOf(dropped));
            diagnostics.emit(Diagnostic.warning(DiagnosticCode.PAYLOAD_DECODE_FAILED, "BrowserTelemetrySession",
                "Dropped unreadable " + what + " field(s) " + dropped, attributes));
        }
        return data;
    }

    private boolean rejectWhenClosed(String what) {
        if (active.get()) return false;
        log.debug("BrowserTelemetrySession: ignoring {} -- session {} is closed", what, sessionId);
        return true;
    }

    // ── Read side ─────────────────────────────────────────────────────────────

    /**
     * Rolled-up view of the session. Does not modify any state.
     */
    public SessionSummary getSessionSummary() {
        ConsoleAnalysis console = consoleMonitor.getAnalysis();
        NetworkAnalysis network = networkMonitor.getAnalysis();
        Double end = endTime;

        return new SessionSummary(
            (end != null ? end : clock.nowSeconds()) - startTime,
            eventLog.totalRecorded(),
            new SessionSummary.ConsoleStats(console.totalMessages(), console.errorCount(),
                console.warningCount(), console.infoCount()),
            new SessionSummary.NetworkStats(network.totalRequests(), network.failedRequests(),
                network.pendingRequests(), network.statusCodes()),
            performance.getLatest(),
            active.get()
        );
    }

    /**
     * Session summary together with the console, network and performance exports.
     */
    public SessionExport exportSummary() {
        return new SessionExport(
            sessionId,
            Instant.now(),
            getSessionSummary(),
            consoleMonitor.exportSummary(),
            networkMonitor.exportSummary(),
            performance.exportSummary()
        );
    }

    /**
     * Stops accepting ingestion. Pending requests stay pending and keep being reported.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!active.compareAndSet(true, false)) return;
        endTime = clock.nowSeconds();
        List<NetworkRequest> stillPending = networkMonitor.getPendingRequests();
        log.info("BrowserTelemetrySession: closed {} after {}s -- {} events, {} pending request(s)",
            sessionId, String.format(Locale.ROOT, "%.1f", endTime - startTime), eventLog.totalRecorded(), stillPending.size());
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public String getSessionId()                    { return sessionId; }
    public boolean isActive()                       { return active.get(); }
    public TelemetryConfig getConfig()              { return config; }
    public EventLog getEventLog()                   { return eventLog; }
    public ConsoleMonitor getConsoleMonitor()       { return consoleMonitor; }
    public NetworkMonitor getNetworkMonitor()       { return networkMonitor; }
    public PerformanceSnapshotAssembler getPerformance() { return performance; }
    public TelemetryDiagnostics getDiagnostics()    { return diagnostics; }
}
