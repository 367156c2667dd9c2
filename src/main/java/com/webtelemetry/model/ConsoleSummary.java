package com.webtelemetry.model;

import java.util.List;
import java.util.Map;

/**
 * Report-ready console export: analysis, per-category detail, critical issues
 * and the most recent timeline entries.
 */
public record ConsoleSummary(
    double monitoringDuration,
    ConsoleAnalysis analysis,
    Map<String, CategorySummary> categories,
    List<CriticalIssue> criticalIssues,
    List<ConsoleTimelineEntry> timeline
) {
}
