package com.webtelemetry.model;

import java.util.List;

/**
 * Report-ready performance export: the analysis plus every snapshot taken.
 */
public record PerformanceSummary(
    double monitoringDuration,
    PerformanceAnalysis analysis,
    int snapshotCount,
    int memorySampleCount,
    List<PerformanceMetrics> snapshots
) {
}
