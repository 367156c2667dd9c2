package com.webtelemetry.performance;

import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.model.PerformanceMetrics;
import com.webtelemetry.support.ManualClock;
import com.webtelemetry.support.RecordingDiagnostics;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Tests for turning raw probe payloads into performance snapshots.
 */
public class PerformanceSnapshotAssemblerTest {

    private ManualClock clock;
    private RecordingDiagnostics diagnostics;

    @BeforeMethod
    public void setUp() {
        clock = new ManualClock();
        diagnostics = new RecordingDiagnostics();
    }

    private static Map<String, Object> fullPayload() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("pageLoadTime", 1234.5);
        raw.put("domContentLoaded", 800L);
        raw.put("firstPaint", 0);
        raw.put("firstContentfulPaint", 310.2);
        raw.put("largestContentfulPaint", 900.0);
        raw.put("cumulativeLayoutShift", 0.02);
        raw.put("memoryUsage", Map.of(
            "usedJSHeapSize", 10_000_000L,
            "totalJSHeapSize", 20_000_000L,
            "jsHeapSizeLimit", 40_000_000L));
        raw.put("resourceCount", 17L);
        return raw;
    }

    @Test
    public void fullPayload_mapsEveryField() {
        PerformanceSnapshotAssembler assembler =
            new PerformanceSnapshotAssembler(PerformanceSnapshotAssemblerTest::fullPayload, clock, diagnostics);

        PerformanceMetrics m = assembler.capture();

        assertThat(m.getTimestamp()).isEqualTo(100.0);
        assertThat(m.getPageLoadTime()).isEqualTo(1234.5);
        assertThat(m.getDomContentLoaded()).isEqualTo(800.0);
        assertThat(m.getFirstPaint()).as("a measured zero is kept").isEqualTo(0.0);
        assertThat(m.getCumulativeLayoutShift()).isEqualTo(0.02);
        assertThat(m.getResourceCount()).isEqualTo(17);
        assertThat(m.getMemoryUsage().usedJsHeapSize()).isEqualTo(10_000_000L);
        assertThat(m.getMemoryUsage().getUsagePercentage()).isEqualTo(25.0);
        assertThat(diagnostics.all()).isEmpty();
    }

    @Test
    public void missingOrNonNumericFields_areAbsent() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("pageLoadTime", "fast");
        raw.put("firstContentfulPaint", null);
        raw.put("memoryUsage", "n/a");

        PerformanceMetrics m = new PerformanceSnapshotAssembler(() -> raw, clock, diagnostics).capture();

        assertThat(m.getPageLoadTime()).isNull();
        assertThat(m.getFirstContentfulPaint()).isNull();
        assertThat(m.getLargestContentfulPaint()).isNull();
        assertThat(m.getMemoryUsage()).isNull();
        assertThat(m.isEmpty()).isTrue();
        assertThat(diagnostics.all()).as("partial data is not a failure").isEmpty();
    }

    @Test
    public void failingProbe_yieldsAbsentSnapshotAndDiagnostic() {
        PerformanceSnapshotAssembler assembler = new PerformanceSnapshotAssembler(
            () -> { throw new IllegalStateException("no browser"); }, clock, diagnostics);

        assertThatCode(assembler::capture).doesNotThrowAnyException();

        assertThat(assembler.getSnapshots()).hasSize(1);
        assertThat(assembler.getLatest().isEmpty()).isTrue();
        assertThat(diagnostics.count(DiagnosticCode.SNAPSHOT_FAILED)).isEqualTo(1);
        assertThat(diagnostics.withCode(DiagnosticCode.SNAPSHOT_FAILED).get(0).message()).contains("no browser");
    }

    @Test
    public void nullPayload_isTreatedAsFailure() {
        PerformanceSnapshotAssembler assembler = new PerformanceSnapshotAssembler(() -> null, clock, diagnostics);

        PerformanceMetrics m = assembler.capture();

        assertThat(m.isEmpty()).isTrue();
        assertThat(m.getTimestamp()).isEqualTo(100.0);
        assertThat(diagnostics.count(DiagnosticCode.SNAPSHOT_FAILED)).isEqualTo(1);
    }

    @Test
    public void snapshots_accumulateInOrder() {
        PerformanceSnapshotAssembler assembler =
            new PerformanceSnapshotAssembler(PerformanceSnapshotAssemblerTest::fullPayload, clock, diagnostics);

        assertThat(assembler.getLatest()).isNull();
        assembler.capture();
        clock.advance(5);
        assembler.capture();

        assertThat(assembler.getSnapshots()).extracting(PerformanceMetrics::getTimestamp).containsExactly(100.0, 105.0);
        assertThat(assembler.getLatest().getTimestamp()).isEqualTo(105.0);
    }
}
