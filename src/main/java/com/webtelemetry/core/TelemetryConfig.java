package com.webtelemetry.core;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for a {@link BrowserTelemetrySession}.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   WEBTELEMETRY_EVENT_LOG_CAPACITY      - Events retained in the session timeline (default: 1000)
 *   WEBTELEMETRY_TIMELINE_SIZE           - Entries in exported console/network timelines (default: 20)
 *   WEBTELEMETRY_CRITICAL_ISSUE_LIMIT    - Critical issues listed in the console analysis (default: 10)
 *   WEBTELEMETRY_CAPTURE_PERFORMANCE     - Take a performance snapshot after each navigation (default: true)
 *   WEBTELEMETRY_HARVEST_PERFORMANCE_LOG - Decode Chrome performance log entries into network events (default: true)
 *   WEBTELEMETRY_PATTERNS_PATH           - JSON file with extra console patterns (optional)
 *
 * Unparseable values fall back to the default.
 */
public class TelemetryConfig {

    public static final int DEFAULT_EVENT_LOG_CAPACITY = 1000;
    public static final int DEFAULT_TIMELINE_SIZE = 20;
    public static final int DEFAULT_CRITICAL_ISSUE_LIMIT = 10;

    private final int eventLogCapacity;
    private final int timelineSize;
    private final int criticalIssueLimit;
    private final boolean capturePerformanceOnNavigation;
    private final boolean harvestPerformanceLog;
    private final Path patternsPath;       // null = built-in patterns only

    private TelemetryConfig(Builder b) {
        this.eventLogCapacity               = b.eventLogCapacity;
        this.timelineSize                   = b.timelineSize;
        this.criticalIssueLimit             = b.criticalIssueLimit;
        this.capturePerformanceOnNavigation = b.capturePerformanceOnNavigation;
        this.harvestPerformanceLog          = b.harvestPerformanceLog;
        this.patternsPath                   = b.patternsPath;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static TelemetryConfig defaults() {
        return builder().build();
    }

    public static TelemetryConfig fromEnvironment() {
        return builder()
            .eventLogCapacity(intEnvOrDefault("WEBTELEMETRY_EVENT_LOG_CAPACITY", DEFAULT_EVENT_LOG_CAPACITY))
            .timelineSize(intEnvOrDefault("WEBTELEMETRY_TIMELINE_SIZE", DEFAULT_TIMELINE_SIZE))
            .criticalIssueLimit(intEnvOrDefault("WEBTELEMETRY_CRITICAL_ISSUE_LIMIT", DEFAULT_CRITICAL_ISSUE_LIMIT))
            .capturePerformanceOnNavigation(boolEnvOrDefault("WEBTELEMETRY_CAPTURE_PERFORMANCE", true))
            .harvestPerformanceLog(boolEnvOrDefault("WEBTELEMETRY_HARVEST_PERFORMANCE_LOG", true))
            .patternsPath(pathEnvOrNull("WEBTELEMETRY_PATTERNS_PATH"))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int getEventLogCapacity()                  { return eventLogCapacity; }
    public int getTimelineSize()                      { return timelineSize; }
    public int getCriticalIssueLimit()                { return criticalIssueLimit; }
    public boolean isCapturePerformanceOnNavigation() { return capturePerformanceOnNavigation; }
    public boolean isHarvestPerformanceLog()          { return harvestPerformanceLog; }
    public Path getPatternsPath()                     { return patternsPath; }
    public boolean isPatternsFileEnabled()            { return patternsPath != null; }

    @Override
    public String toString() {
        return String.format("TelemetryConfig{eventLog=%d, timeline=%d, criticalIssues=%d, perfOnNav=%b, perfLog=%b, patterns=%s}",
            eventLogCapacity, timelineSize, criticalIssueLimit, capturePerformanceOnNavigation,
            harvestPerformanceLog, patternsPath != null ? patternsPath : "built-in");
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private int eventLogCapacity = DEFAULT_EVENT_LOG_CAPACITY;
        private int timelineSize = DEFAULT_TIMELINE_SIZE;
        private int criticalIssueLimit = DEFAULT_CRITICAL_ISSUE_LIMIT;
        private boolean capturePerformanceOnNavigation = true;
        private boolean harvestPerformanceLog = true;
        private Path patternsPath = null;

        public Builder eventLogCapacity(int n)                    { this.eventLogCapacity = n; return this; }
        public Builder timelineSize(int n)                        { this.timelineSize = n; return this; }
        public Builder criticalIssueLimit(int n)                  { this.criticalIssueLimit = n; return this; }
        public Builder capturePerformanceOnNavigation(boolean b)  { this.capturePerformanceOnNavigation = b; return this; }
        public Builder harvestPerformanceLog(boolean b)           { this.harvestPerformanceLog = b; return this; }
        public Builder patternsPath(Path path)                    { this.patternsPath = path; return this; }
        public Builder patternsPath(String path) {
            this.patternsPath = (path != null && !path.isBlank()) ? Paths.get(path) : null;
            return this;
        }

        public TelemetryConfig build() {
            if (eventLogCapacity < 1) {
                throw new IllegalArgumentException("eventLogCapacity must be >= 1, was " + eventLogCapacity);
            }
            if (timelineSize < 0 || criticalIssueLimit < 0) {
                throw new IllegalArgumentException("timelineSize and criticalIssueLimit must be >= 0");
            }
            return new TelemetryConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static int intEnvOrDefault(String key, int defaultValue) {
        try {
            String val = System.getenv(key);
            int parsed = (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
            return parsed >= 1 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    private static Path pathEnvOrNull(String key) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : null;
    }
}
