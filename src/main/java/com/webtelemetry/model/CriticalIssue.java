package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A console message that requires attention, as listed by
 * {@link com.webtelemetry.console.ConsoleMonitor#getCriticalIssues()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CriticalIssue(
    double timestamp,
    ConsoleLevel level,
    String text,
    String category,
    List<String> patterns,
    ConsoleLocation location
) {

    public static CriticalIssue from(ConsoleMessage message) {
        return new CriticalIssue(message.getTimestamp(), message.getLevel(), message.getText(),
            message.getCategory(), List.copyOf(message.getPatternsMatched()), message.getLocation());
    }
}
