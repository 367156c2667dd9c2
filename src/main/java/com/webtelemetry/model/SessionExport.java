package com.webtelemetry.model;

import java.time.Instant;

/**
 * Everything a report needs about one session in a single JSON-serializable value.
 * {@code exportedAt} is wall-clock time; all other timestamps are session-monotonic seconds.
 */
public record SessionExport(
    String sessionId,
    Instant exportedAt,
    SessionSummary summary,
    ConsoleSummary console,
    NetworkSummary network,
    PerformanceSummary performance
) {
}
