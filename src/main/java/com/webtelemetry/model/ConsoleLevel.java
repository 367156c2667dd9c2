package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Console message levels with their fixed severity score.
 *
 * The score scale is not configurable:
 *   ERROR, ASSERT = 5
 *   WARNING       = 3
 *   INFO, LOG     = 1
 *   DEBUG         = 0
 */
public enum ConsoleLevel {
    ERROR(5),
    WARNING(3),
    INFO(1),
    DEBUG(0),
    LOG(1),
    ASSERT(5);

    private final int severityScore;

    ConsoleLevel(int severityScore) {
        this.severityScore = severityScore;
    }

    public int getSeverityScore() { return severityScore; }

    /** Lower-case browser name, e.g. "warning". Used for JSON output. */
    @JsonValue
    public String getName() { return name().toLowerCase(Locale.ROOT); }

    /**
     * Parses a level name as reported by the browser or by Selenium.
     * Accepts "warn", "severe", "fine", "verbose" and "trace" aliases.
     * Null, blank or unrecognized names map to INFO.
     */
    @JsonCreator
    public static ConsoleLevel parse(String raw) {
        if (raw == null || raw.isBlank()) return INFO;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "error":
            case "severe":
                return ERROR;
            case "warning":
            case "warn":
                return WARNING;
            case "info":
                return INFO;
            case "debug":
            case "fine":
            case "finer":
            case "finest":
            case "verbose":
            case "trace":
                return DEBUG;
            case "log":
                return LOG;
            case "assert":
                return ASSERT;
            default:
                return INFO;
        }
    }
}
