package com.webtelemetry.performance;

import com.webtelemetry.core.TelemetryClock;
import com.webtelemetry.diagnostics.Diagnostic;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.diagnostics.TelemetryDiagnostics;
import com.webtelemetry.model.MemoryUsage;
import com.webtelemetry.model.PerformanceAnalysis;
import com.webtelemetry.model.PerformanceMetrics;
import com.webtelemetry.model.PerformanceSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link PerformanceMetrics} snapshots from a {@link PerformanceProbe}
 * and keeps every snapshot taken during the session.
 *
 * Missing or non-numeric figures become null. A failing probe still yields a
 * snapshot, with every figure absent, so the session history shows the attempt.
 * {@link #getAnalysis()} grades the collected snapshots with {@link PerformanceAnalyzer}.
 */
public class PerformanceSnapshotAssembler {

    private static final Logger log = LoggerFactory.getLogger(PerformanceSnapshotAssembler.class);

    private final PerformanceProbe probe;
    private final TelemetryClock clock;
    private final TelemetryDiagnostics diagnostics;
    private final double startTime;
    private final List<PerformanceMetrics> snapshots = new ArrayList<>();

    public PerformanceSnapshotAssembler(PerformanceProbe probe, TelemetryClock clock, TelemetryDiagnostics diagnostics) {
        this.probe       = probe;
        this.clock       = clock;
        this.diagnostics = diagnostics;
        this.startTime   = clock.nowSeconds();
    }

    /**
     * Runs the probe and records the resulting snapshot. Never throws.
     */
    public PerformanceMetrics capture() {
        Map<String, Object> raw = null;
        String failure = null;
        try {
            raw = probe != null ? probe.collect() : null;
            if (raw == null) {
                failure = "probe returned no data";
            }
        } catch (Exception e) {
            failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        double timestamp = clock.nowSeconds();
        PerformanceMetrics metrics;
        if (failure != null) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("reason", failure);
            diagnostics.emit(Diagnostic.warning(DiagnosticCode.SNAPSHOT_FAILED, "PerformanceSnapshotAssembler",
                "Performance snapshot unavailable: " + failure, attributes));
            metrics = PerformanceMetrics.absent(timestamp);
        } else {
            metrics = fromRaw(timestamp, raw);
            log.debug("PerformanceSnapshotAssembler: {}", metrics);
        }

        synchronized (this) {
            snapshots.add(metrics);
        }
        return metrics;
    }

    /**
     * Maps the raw probe payload onto a snapshot. Keys follow the browser's
     * naming ({@code usedJSHeapSize} etc).
     */
    static PerformanceMetrics fromRaw(double timestamp, Map<String, Object> raw) {
        return PerformanceMetrics.builder()
            .timestamp(timestamp)
            .pageLoadTime(number(raw.get("pageLoadTime")))
            .domContentLoaded(number(raw.get("domContentLoaded")))
            .firstPaint(number(raw.get("firstPaint")))
            .firstContentfulPaint(number(raw.get("firstContentfulPaint")))
            .largestContentfulPaint(number(raw.get("largestContentfulPaint")))
            .cumulativeLayoutShift(number(raw.get("cumulativeLayoutShift")))
            .memoryUsage(memory(raw.get("memoryUsage")))
            .resourceCount(integer(raw.get("resourceCount")))
            .build();
    }

    private static MemoryUsage memory(Object value) {
        if (!(value instanceof Map<?, ?> map)) return null;
        Long used  = whole(map.get("usedJSHeapSize"));
        Long total = whole(map.get("totalJSHeapSize"));
        Long limit = whole(map.get("jsHeapSizeLimit"));
        if (used == null && total == null && limit == null) return null;
        return new MemoryUsage(used, total, limit);
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        }
        return null;
    }

    private static Long whole(Object value) {
        Double d = number(value);
        return d != null ? d.longValue() : null;
    }

    private static Integer integer(Object value) {
        Double d = number(value);
        return d != null ? d.intValue() : null;
    }

    // ── Analysis ──────────────────────────────────────────────────────────────

    /** Recomputes the performance analysis over every snapshot taken so far. */
    public synchronized PerformanceAnalysis getAnalysis() {
        return PerformanceAnalyzer.analyze(List.copyOf(snapshots));
    }

    public synchronized PerformanceSummary exportSummary() {
        List<PerformanceMetrics> taken = List.copyOf(snapshots);
        return new PerformanceSummary(
            clock.nowSeconds() - startTime,
            PerformanceAnalyzer.analyze(taken),
            taken.size(),
            PerformanceAnalyzer.memorySampleCount(taken),
            taken
        );
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    /** Every snapshot taken so far, oldest first. */
    public synchronized List<PerformanceMetrics> getSnapshots() {
        return List.copyOf(snapshots);
    }

    /** The most recent snapshot, or null if none has been taken. */
    public synchronized PerformanceMetrics getLatest() {
        return snapshots.isEmpty() ? null : snapshots.get(snapshots.size() - 1);
    }
}
