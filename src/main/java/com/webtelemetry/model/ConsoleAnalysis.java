package com.webtelemetry.model;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over every console message in a session.
 *
 * Level counts use the browser-reported level; {@code severityScore} is the mean
 * rule-derived score across all messages.
 */
public record ConsoleAnalysis(
    int totalMessages,
    int errorCount,
    int warningCount,
    int infoCount,
    Map<String, Integer> categories,
    List<String> criticalIssues,
    List<PatternFrequency> patternsDetected,
    List<String> recommendations,
    double severityScore
) {

    public static ConsoleAnalysis empty() {
        return new ConsoleAnalysis(0, 0, 0, 0, Map.of(), List.of(), List.of(), List.of(), 0.0);
    }
}
