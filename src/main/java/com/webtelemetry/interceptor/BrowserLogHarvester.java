package com.webtelemetry.interceptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webtelemetry.core.BrowserTelemetrySession;
import com.webtelemetry.core.TelemetryPayloads;
import com.webtelemetry.diagnostics.Diagnostic;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.model.ConsoleEventData;
import com.webtelemetry.model.ConsoleLocation;
import com.webtelemetry.model.NetworkTiming;
import com.webtelemetry.model.RequestEventData;
import com.webtelemetry.model.RequestFailedEventData;
import com.webtelemetry.model.ResponseEventData;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.logging.LogEntry;
import org.openqa.selenium.logging.LogType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls Chrome's browser and performance logs through Selenium and feeds them
 * into a {@link BrowserTelemetrySession}.
 *
 * ## Browser log
 * Each entry becomes a console message. Chrome prefixes the text with
 * {@code "<url> <line>:<column> "}; that prefix is parsed into the message location.
 *
 * ## Performance log
 * Entries carry DevTools protocol events as JSON. The harvester decodes
 * {@code Network.requestWillBeSent}, {@code Network.requestServedFromCache},
 * {@code Network.responseReceived}, {@code Network.dataReceived},
 * {@code Network.loadingFinished} and {@code Network.loadingFailed}. A response is
 * held until its body has finished loading so decoded and encoded sizes are known;
 * {@link #flushPendingResponses()} completes whatever is still held.
 *
 * Network timestamps are DevTools monotonic seconds. They are consistent within a
 * request, so durations are exact, but they do not share an origin with the session clock.
 *
 * Requires logging preferences set by {@link TelemetryChromeOptions}.
 */
public class BrowserLogHarvester {

    private static final Logger log = LoggerFactory.getLogger(BrowserLogHarvester.class);

    private static final Pattern CHROME_PREFIX = Pattern.compile("^(\\S+) (\\d+):(\\d+) (.*)$", Pattern.DOTALL);

    private final BrowserTelemetrySession session;
    private final ObjectMapper mapper = TelemetryPayloads.mapper();

    private final Set<String> servedFromCache = new HashSet<>();
    private final Map<String, HeldResponse> heldResponses = new LinkedHashMap<>();
    private final Map<String, Long> decodedBytes = new HashMap<>();
    private final Set<String> unavailableLogs = new HashSet<>();

    /** A response whose body has not finished loading yet. */
    private record HeldResponse(ResponseEventData data, Double requestTime, Double receiveHeadersEnd) {}

    public BrowserLogHarvester(BrowserTelemetrySession session) {
        this.session = session;
    }

    // ── Driver-facing ─────────────────────────────────────────────────────────

    /**
     * Drains the browser log and, when enabled, the performance log.
     *
     * @return number of log entries processed
     */
    public synchronized int harvest(WebDriver driver) {
        int processed = 0;
        Iterable<LogEntry> browser = fetch(driver, LogType.BROWSER);
        if (browser != null) {
            processed += ingestBrowserLog(browser);
        }
        if (session.getConfig().isHarvestPerformanceLog()) {
            Iterable<LogEntry> performance = fetch(driver, LogType.PERFORMANCE);
            if (performance != null) {
                processed += ingestPerformanceLog(performance);
            }
        }
        return processed;
    }

    private Iterable<LogEntry> fetch(WebDriver driver, String logType) {
        try {
            return driver.manage().logs().get(logType);
        } catch (Exception e) {
            // Reported once per log type; most drivers never expose these logs
            if (unavailableLogs.add(logType)) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("logType", logType);
                attributes.put("exception", e.getClass().getSimpleName());
                session.getDiagnostics().emit(Diagnostic.warning(DiagnosticCode.LOG_DECODE_FAILED,
                    "BrowserLogHarvester", "Log '" + logType + "' not available: " + e.getMessage(), attributes));
            }
            return null;
        }
    }

    // ── Browser log ───────────────────────────────────────────────────────────

    public synchronized int ingestBrowserLog(Iterable<LogEntry> entries) {
        int count = 0;
        for (LogEntry entry : entries) {
            session.onConsoleMessage(toConsoleEvent(entry));
            count++;
        }
        if (count > 0) {
            log.debug("BrowserLogHarvester: ingested {} browser log entries", count);
        }
        return count;
    }

    // LogEntry.getTimestamp() is epoch millis, not session time; the session clock stamps these
    static ConsoleEventData toConsoleEvent(LogEntry entry) {
        String level = entry.getLevel() != null ? entry.getLevel().getName() : null;
        String message = entry.getMessage() != null ? entry.getMessage() : "";

        Matcher m = CHROME_PREFIX.matcher(message);
        if (!m.matches()) {
            return new ConsoleEventData(message, level, null, null, null);
        }
        ConsoleLocation location = new ConsoleLocation(m.group(1),
            Integer.valueOf(m.group(2)), Integer.valueOf(m.group(3)));
        return new ConsoleEventData(unquote(m.group(4)), level, location, null, null);
    }

    // console-api entries wrap the logged string in JSON quotes
    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1).replace("\\\"", "\"");
        }
        return text;
    }

    // ── Performance log ───────────────────────────────────────────────────────

    public synchronized int ingestPerformanceLog(Iterable<LogEntry> entries) {
        int count = 0;
        for (LogEntry entry : entries) {
            try {
                JsonNode message = mapper.readTree(entry.getMessage()).path("message");
                dispatch(message.path("method").asText(""), message.path("params"));
                count++;
            } catch (JsonProcessingException | RuntimeException e) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("logType", LogType.PERFORMANCE);
                attributes.put("exception", e.getClass().getSimpleName());
                session.getDiagnostics().emit(Diagnostic.warning(DiagnosticCode.LOG_DECODE_FAILED,
                    "BrowserLogHarvester", "Could not decode performance log entry: " + e.getMessage(), attributes));
            }
        }
        return count;
    }

    private void dispatch(String method, JsonNode params) {
        switch (method) {
            case "Network.requestWillBeSent":
                onRequestWillBeSent(params);
                break;
            case "Network.requestServedFromCache":
                servedFromCache.add(params.path("requestId").asText());
                break;
            case "Network.responseReceived":
                onResponseReceived(params);
                break;
            case "Network.dataReceived":
                decodedBytes.merge(params.path("requestId").asText(), params.path("dataLength").asLong(0), Long::sum);
                break;
            case "Network.loadingFinished":
                onLoadingFinished(params);
                break;
            case "Network.loadingFailed":
                onLoadingFailed(params);
                break;
            default:
                break;
        }
    }

    private void onRequestWillBeSent(JsonNode params) {
        String requestId = params.path("requestId").asText();
        double timestamp = params.path("timestamp").asDouble();
        JsonNode request = params.path("request");

        // Chrome reuses the request id across a redirect chain
        JsonNode redirect = params.path("redirectResponse");
        if (!redirect.isMissingNode() && session.getNetworkMonitor().isPending(requestId)) {
            ResponseEventData hop = new ResponseEventData(redirect.path("status").asInt(),
                stringMap(redirect.path("headers")), null, null, null,
                redirect.path("fromDiskCache").asBoolean(false), null,
                redirect.path("fromServiceWorker").asBoolean(false), null, timestamp);
            session.onResponse(requestId, hop);
        }

        Map<String, Object> initiator = params.has("initiator")
            ? mapper.convertValue(params.get("initiator"), mapper.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, Object.class))
            : null;

        session.onRequest(new RequestEventData(
            requestId,
            request.path("url").asText(null),
            request.path("method").asText("GET"),
            stringMap(request.path("headers")),
            params.path("type").asText("other").toLowerCase(Locale.ROOT),
            initiator,
            request.has("postData") ? request.get("postData").asText() : null,
            timestamp
        ));
    }

    private void onResponseReceived(JsonNode params) {
        String requestId = params.path("requestId").asText();
        JsonNode response = params.path("response");
        JsonNode timing = response.path("timing");

        ResponseEventData data = new ResponseEventData(
            response.path("status").asInt(),
            stringMap(response.path("headers")),
            null,
            null,
            servedFromCache.remove(requestId) ? "from-cache" : null,
            response.path("fromDiskCache").asBoolean(false),
            response.path("fromPrefetchCache").asBoolean(false),
            response.path("fromServiceWorker").asBoolean(false),
            toTiming(timing),
            params.path("timestamp").asDouble()
        );
        heldResponses.put(requestId, new HeldResponse(data,
            timing.has("requestTime") ? timing.get("requestTime").asDouble() : null,
            phase(timing, "receiveHeadersEnd")));
    }

    private void onLoadingFinished(JsonNode params) {
        String requestId = params.path("requestId").asText();
        HeldResponse held = heldResponses.remove(requestId);
        Long decoded = decodedBytes.remove(requestId);
        if (held == null) return;

        long encoded = params.path("encodedDataLength").asLong(0);
        Long size = decoded != null && decoded > 0 ? decoded : (encoded > 0 ? encoded : null);
        Long compressed = encoded > 0 ? encoded : null;

        NetworkTiming timing = held.data().timing();
        if (held.requestTime() != null && params.has("timestamp")) {
            double total = (params.get("timestamp").asDouble() - held.requestTime()) * 1000.0;
            Double download = held.receiveHeadersEnd() != null ? Math.max(0.0, total - held.receiveHeadersEnd()) : null;
            timing = new NetworkTiming(timing.dnsLookup(), timing.tcpConnect(), timing.tlsHandshake(),
                timing.requestSent(), timing.waiting(), download, total);
        }

        ResponseEventData d = held.data();
        session.onResponse(requestId, new ResponseEventData(d.status(), d.headers(), size, compressed,
            d.fromCache(), d.fromDiskCache(), d.fromMemoryCache(), d.fromServiceWorker(), timing, d.timestamp()));
    }

    private void onLoadingFailed(JsonNode params) {
        String requestId = params.path("requestId").asText();
        heldResponses.remove(requestId);
        decodedBytes.remove(requestId);
        servedFromCache.remove(requestId);

        session.onRequestFailed(new RequestFailedEventData(requestId,
            params.path("errorText").asText("unknown error"),
            params.path("blockedReason").asText(null),
            params.path("timestamp").asDouble()));
    }

    /**
     * Completes every response still waiting for its body, without size figures.
     *
     * @return number of responses completed
     */
    public synchronized int flushPendingResponses() {
        int flushed = 0;
        for (Iterator<Map.Entry<String, HeldResponse>> it = heldResponses.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, HeldResponse> e = it.next();
            session.onResponse(e.getKey(), e.getValue().data());
            it.remove();
            flushed++;
        }
        decodedBytes.clear();
        return flushed;
    }

    // ── DevTools helpers ──────────────────────────────────────────────────────

    /** Converts DevTools resource timing (ms offsets from requestTime, -1 = absent) to phase durations. */
    static NetworkTiming toTiming(JsonNode timing) {
        if (timing == null || timing.isMissingNode() || timing.isNull()) {
            return NetworkTiming.empty();
        }
        Double sendEnd = phase(timing, "sendEnd");
        Double headersEnd = phase(timing, "receiveHeadersEnd");
        return new NetworkTiming(
            span(timing, "dnsStart", "dnsEnd"),
            span(timing, "connectStart", "connectEnd"),
            span(timing, "sslStart", "sslEnd"),
            span(timing, "sendStart", "sendEnd"),
            sendEnd != null && headersEnd != null ? headersEnd - sendEnd : null,
            null,
            headersEnd
        );
    }

    private static Double span(JsonNode timing, String start, String end) {
        Double s = phase(timing, start);
        Double e = phase(timing, end);
        return s != null && e != null && e >= s ? e - s : null;
    }

    private static Double phase(JsonNode timing, String field) {
        JsonNode v = timing.path(field);
        if (!v.isNumber()) return null;
        double d = v.asDouble();
        return d < 0 ? null : d;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        Map<String, String> out = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        return out;
    }

    /** Responses decoded but not yet completed. */
    public synchronized int getHeldResponseCount() {
        return heldResponses.size();
    }
}
