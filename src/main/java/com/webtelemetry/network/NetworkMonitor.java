package com.webtelemetry.network;

import com.webtelemetry.core.TelemetryClock;
import com.webtelemetry.core.TelemetryConfig;
import com.webtelemetry.diagnostics.Diagnostic;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.diagnostics.TelemetryDiagnostics;
import com.webtelemetry.model.DomainStats;
import com.webtelemetry.model.NetworkAnalysis;
import com.webtelemetry.model.NetworkRequest;
import com.webtelemetry.model.NetworkSummary;
import com.webtelemetry.model.NetworkTimelineEntry;
import com.webtelemetry.model.NetworkTiming;
import com.webtelemetry.model.RequestEventData;
import com.webtelemetry.model.RequestFailedEventData;
import com.webtelemetry.model.RequestSummary;
import com.webtelemetry.model.ResponseEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Correlates request, response and failure events into {@link NetworkRequest}s
 * and produces the network analysis for a session.
 *
 * ## Correlation
 * A request is indexed by id while pending. The response or failure for that id
 * moves it to the completed list exactly once. Events for an unknown id, or for
 * an id that is already terminal, are reported as a correlation miss and ignored.
 *
 * ## Thread Safety
 * All state is guarded by the monitor's intrinsic lock, so the pending index and
 * the completed list always change together.
 */
public class NetworkMonitor {

    private static final Logger log = LoggerFactory.getLogger(NetworkMonitor.class);

    static final int RANKING_SIZE = 5;

    private final TelemetryClock clock;
    private final TelemetryDiagnostics diagnostics;
    private final int timelineSize;
    private final double startTime;

    private final Map<String, NetworkRequest> pending = new LinkedHashMap<>();
    private final List<NetworkRequest> completed = new ArrayList<>();
    private final Set<String> domainsSeen = new LinkedHashSet<>();
    private final Set<String> resourceTypesSeen = new LinkedHashSet<>();
    private long sequence = 0;

    public NetworkMonitor() {
        this(TelemetryClock.system(), TelemetryDiagnostics.slf4j(), TelemetryConfig.defaults());
    }

    public NetworkMonitor(TelemetryClock clock, TelemetryDiagnostics diagnostics, TelemetryConfig config) {
        this.clock        = clock;
        this.diagnostics  = diagnostics;
        this.timelineSize = config.getTimelineSize();
        this.startTime    = clock.nowSeconds();
    }

    // ── Ingestion ─────────────────────────────────────────────────────────────

    /**
     * Registers an outgoing request as pending.
     *
     * @return the caller's request id, or a freshly minted one when none was given
     */
    public synchronized String addRequest(RequestEventData raw) {
        RequestEventData data = raw != null ? raw : new RequestEventData(null, null, null, null, null, null, null, null);
        double timestamp = data.timestamp() != null ? data.timestamp() : clock.nowSeconds();
        sequence++;

        String requestId = data.requestId();
        if (requestId == null || requestId.isBlank()) {
            requestId = String.format(Locale.ROOT, "req-%.6f-%d", timestamp, sequence);
        }

        NetworkRequest request = new NetworkRequest(requestId, data.url(), data.method(), data.headers(),
            timestamp, data.resourceType(), data.initiator(), data.postData());

        NetworkRequest replaced = pending.put(requestId, request);
        if (replaced != null) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("requestId", requestId);
            attributes.put("replacedUrl", replaced.getUrl());
            diagnostics.emit(Diagnostic.warning(DiagnosticCode.DUPLICATE_REQUEST_ID, "NetworkMonitor",
                "Request id " + requestId + " was still pending; replacing it", attributes));
        }
        domainsSeen.add(request.getDomain());
        resourceTypesSeen.add(request.getResourceType());

        log.debug("NetworkMonitor: {} {} [{}] id={}", request.getMethod(), request.getUrl(),
            request.getResourceType(), requestId);
        return requestId;
    }

    /**
     * Completes a pending request. Unknown ids are reported and ignored.
     */
    public synchronized void addResponse(String requestId, ResponseEventData raw) {
        NetworkRequest request = lookupPending(requestId, "response");
        if (request == null) return;

        ResponseEventData data = raw != null ? raw
            : new ResponseEventData(null, null, null, null, null, null, null, null, null, null);
        double timestamp = data.timestamp() != null ? data.timestamp() : clock.nowSeconds();

        NetworkRequest done = request.completed(
            data.status() != null ? data.status() : 0,
            data.headers(),
            timestamp,
            data.size(),
            data.compressedSize(),
            data.timing() != null ? data.timing() : NetworkTiming.empty(),
            data.isCacheHit(),
            Boolean.TRUE.equals(data.fromServiceWorker())
        );
        pending.remove(requestId);
        completed.add(done);

        log.debug("NetworkMonitor: {} {} -> {} in {} ms{}", done.getMethod(), done.getUrl(),
            done.getResponseStatus(), done.getDurationMs(), done.isCacheHit() ? " (cache)" : "");
    }

    public void addRequestFailure(String requestId, String error, String blockedReason) {
        addRequestFailure(new RequestFailedEventData(requestId, error, blockedReason, null));
    }

    /**
     * Marks a pending request as failed. Unknown ids are reported and ignored.
     */
    public synchronized void addRequestFailure(RequestFailedEventData data) {
        if (data == null) return;
        String requestId = data.requestId();
        NetworkRequest request = lookupPending(requestId, "failure");
        if (request == null) return;

        double timestamp = data.timestamp() != null ? data.timestamp() : clock.nowSeconds();
        NetworkRequest done = request.failed(data.error(), data.blockedReason(), timestamp);
        pending.remove(requestId);
        completed.add(done);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("requestId", requestId);
        attributes.put("url", done.getUrl());
        attributes.put("error", done.getError());
        if (done.isBlocked()) {
            attributes.put("blockedReason", done.getBlockedReason());
        }
        diagnostics.emit(Diagnostic.warning(DiagnosticCode.REQUEST_FAILED, "NetworkMonitor",
            "Request failed: " + done.getUrl() + " - " + done.getError(), attributes));
    }

    private NetworkRequest lookupPending(String requestId, String eventKind) {
        NetworkRequest request = requestId != null ? pending.get(requestId) : null;
        if (request == null) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("requestId", String.valueOf(requestId));
            attributes.put("event", eventKind);
            diagnostics.emit(Diagnostic.warning(DiagnosticCode.CORRELATION_MISS, "NetworkMonitor",
                "No pending request for " + eventKind + " with id " + requestId, attributes));
        }
        return request;
    }

    // ── Analysis ──────────────────────────────────────────────────────────────

    /**
     * Recomputes the network analysis over terminal requests.
     * Returns {@link NetworkAnalysis#empty(int)} when no request has completed or failed.
     */
    public synchronized NetworkAnalysis getAnalysis() {
        if (completed.isEmpty()) {
            return NetworkAnalysis.empty(pending.size());
        }

        int total = completed.size();
        int successful = 0, failed = 0, blocked = 0, cached = 0;
        long totalBytes = 0, totalCompressed = 0;
        double durationSum = 0;
        List<NetworkRequest> timed = new ArrayList<>();
        Map<String, Integer> resourceTypes = new LinkedHashMap<>();
        Map<String, Integer> domains = new LinkedHashMap<>();
        Map<Integer, Integer> statusCodes = new TreeMap<>();

        for (NetworkRequest r : completed) {
            if (r.isSuccessful()) successful++;
            if (r.isError()) failed++;
            if (r.isBlocked()) blocked++;
            if (r.isCacheHit()) cached++;
            if (r.hasDuration()) {
                timed.add(r);
                durationSum += r.getDurationMs();
            }
            if (r.getSize() != null && r.getSize() > 0) totalBytes += r.getSize();
            if (r.getCompressedSize() != null && r.getCompressedSize() > 0) totalCompressed += r.getCompressedSize();

            resourceTypes.merge(r.getResourceType(), 1, Integer::sum);
            domains.merge(r.getDomain(), 1, Integer::sum);
            if (r.getResponseStatus() != null && r.getResponseStatus() > 0) {
                statusCodes.merge(r.getResponseStatus(), 1, Integer::sum);
            }
        }

        double averageResponseTime = timed.isEmpty() ? 0.0 : durationSum / timed.size();
        double compressionRatio = totalBytes > 0
            ? Math.max(0.0, Math.min(1.0, 1.0 - (double) totalCompressed / totalBytes))
            : 0.0;

        timed.sort(Comparator.comparingDouble(NetworkRequest::getDurationMs));
        List<RequestSummary> fastest = new ArrayList<>();
        for (int i = 0; i < Math.min(RANKING_SIZE, timed.size()); i++) {
            fastest.add(RequestSummary.from(timed.get(i)));
        }
        List<RequestSummary> slowest = new ArrayList<>();
        for (int i = timed.size() - 1; i >= Math.max(0, timed.size() - RANKING_SIZE); i--) {
            slowest.add(RequestSummary.from(timed.get(i)));
        }

        NetworkIssueAnalyzer.Findings findings = NetworkIssueAnalyzer.analyze(
            total, failed, averageResponseTime, statusCodes, domains, resourceTypes);
        double score = NetworkIssueAnalyzer.performanceScore(
            (double) successful / total, averageResponseTime, (double) cached / total);

        return new NetworkAnalysis(
            total,
            successful,
            failed,
            blocked,
            cached,
            pending.size(),
            averageResponseTime,
            List.copyOf(slowest),
            List.copyOf(fastest),
            Collections.unmodifiableMap(resourceTypes),
            Collections.unmodifiableMap(domains),
            Collections.unmodifiableMap(statusCodes),
            totalBytes,
            totalCompressed,
            compressionRatio,
            findings.issues(),
            findings.recommendations(),
            score
        );
    }

    /**
     * Per-domain rollup of terminal requests, in first-seen order.
     */
    public synchronized Map<String, DomainStats> getDomainAnalysis() {
        Map<String, List<NetworkRequest>> byDomain = new LinkedHashMap<>();
        for (NetworkRequest r : completed) {
            byDomain.computeIfAbsent(r.getDomain(), k -> new ArrayList<>()).add(r);
        }

        Map<String, DomainStats> result = new LinkedHashMap<>();
        byDomain.forEach((domain, requests) -> result.put(domain, domainStats(domain, requests)));
        return Collections.unmodifiableMap(result);
    }

    private static DomainStats domainStats(String domain, List<NetworkRequest> requests) {
        int successful = 0, failed = 0;
        long bytes = 0;
        Double min = null, max = null;
        double sum = 0;
        int timedCount = 0;
        Map<String, Integer> resourceTypes = new LinkedHashMap<>();
        Map<Integer, Integer> statusCodes = new TreeMap<>();

        for (NetworkRequest r : requests) {
            if (r.isSuccessful()) {
                successful++;
            } else if (r.isError()) {
                failed++;
            }
            if (r.getSize() != null && r.getSize() > 0) bytes += r.getSize();
            if (r.hasDuration()) {
                double d = r.getDurationMs();
                min = min == null ? d : Math.min(min, d);
                max = max == null ? d : Math.max(max, d);
                sum += d;
                timedCount++;
            }
            resourceTypes.merge(r.getResourceType(), 1, Integer::sum);
            if (r.getResponseStatus() != null && r.getResponseStatus() > 0) {
                statusCodes.merge(r.getResponseStatus(), 1, Integer::sum);
            }
        }

        return new DomainStats(
            domain,
            requests.size(),
            successful,
            failed,
            bytes,
            timedCount > 0 ? sum / timedCount : null,
            min,
            max,
            (double) successful / requests.size(),
            Collections.unmodifiableMap(resourceTypes),
            Collections.unmodifiableMap(statusCodes)
        );
    }

    /**
     * Analysis, domain rollup, pending count and the most recent terminal
     * requests by request time, ready to be serialized into a report.
     */
    public synchronized NetworkSummary exportSummary() {
        List<NetworkRequest> ordered = new ArrayList<>(completed);
        ordered.sort(Comparator.comparingDouble(NetworkRequest::getRequestTimestamp));
        List<NetworkTimelineEntry> timeline = new ArrayList<>();
        for (NetworkRequest r : ordered.subList(Math.max(0, ordered.size() - timelineSize), ordered.size())) {
            timeline.add(NetworkTimelineEntry.from(r));
        }

        return new NetworkSummary(
            clock.nowSeconds() - startTime,
            getAnalysis(),
            getDomainAnalysis(),
            pending.size(),
            List.copyOf(timeline)
        );
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    /** Requests still awaiting a response or failure, in arrival order. */
    public synchronized List<NetworkRequest> getPendingRequests() {
        return List.copyOf(pending.values());
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    public synchronized boolean isPending(String requestId) {
        return requestId != null && pending.containsKey(requestId);
    }

    /** Terminal requests in the order they completed or failed. */
    public synchronized List<NetworkRequest> getCompletedRequests() {
        return List.copyOf(completed);
    }

    public synchronized Set<String> getDomainsSeen() {
        return Set.copyOf(domainsSeen);
    }

    public synchronized Set<String> getResourceTypesSeen() {
        return Set.copyOf(resourceTypesSeen);
    }
}
