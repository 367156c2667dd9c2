package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Rolled-up view of one evaluation session, consumed by reporting.
 * {@code performance} is the latest snapshot, or null if none was taken.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSummary(
    double sessionDuration,
    long totalEvents,
    ConsoleStats console,
    NetworkStats network,
    PerformanceMetrics performance,
    boolean monitoringActive
) {

    public record ConsoleStats(int total, int errors, int warnings, int info) {}

    public record NetworkStats(int totalRequests, int failedRequests, int pendingRequests,
                               Map<Integer, Integer> statusCodes) {}
}
