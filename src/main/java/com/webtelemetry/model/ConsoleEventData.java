package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Raw console event as delivered by the browser instrumentation.
 *
 * @param text       message text; null is treated as ""
 * @param level      browser level name ("error", "warning", "log", ...)
 * @param location   optional source position
 * @param stackTrace optional stack trace
 * @param timestamp  optional monotonic seconds; the session clock is used when null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsoleEventData(String text, String level, ConsoleLocation location,
                               String stackTrace, Double timestamp) {

    public static ConsoleEventData of(String level, String text) {
        return new ConsoleEventData(text, level, null, null, null);
    }
}
