package com.webtelemetry.model;

import java.util.List;
import java.util.Map;

/**
 * Report-ready network export: analysis, per-domain rollup, pending count and
 * the most recent requests.
 */
public record NetworkSummary(
    double monitoringDuration,
    NetworkAnalysis analysis,
    Map<String, DomainStats> domainAnalysis,
    int pendingRequests,
    List<NetworkTimelineEntry> timeline
) {
}
