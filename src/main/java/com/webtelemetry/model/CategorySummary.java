package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Detail for one console category: the last ten messages plus occurrence bounds.
 * Occurrence timestamps are null for a category with no messages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategorySummary(
    String category,
    int count,
    List<ConsoleMessage> messages,
    Double firstOccurrence,
    Double lastOccurrence,
    int uniqueMessages
) {

    public static CategorySummary empty(String category) {
        return new CategorySummary(category, 0, List.of(), null, null, 0);
    }
}
