package com.webtelemetry.model;

public record ConsoleTimelineEntry(double timestamp, double relativeTime, ConsoleLevel level,
                                   String category, String text) {
}
