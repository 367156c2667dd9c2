package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Page-performance analysis recomputed from every snapshot of the session.
 *
 * {@code overallScore} averages 100/75/25 per reported vital and is 50 when no
 * vital was reported. Timing and memory figures come from the latest snapshot
 * that measured them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerformanceAnalysis(
    CoreWebVitals coreWebVitals,
    double overallScore,
    PerformanceGrade overallGrade,
    Double pageLoadTime,
    Double domContentLoaded,
    Double firstPaint,
    Integer totalResources,
    Double memoryUsagePercentage,
    PerformanceGrade memoryGrade,
    List<String> bottlenecks,
    List<String> recommendations,
    List<String> criticalIssues
) {
}
