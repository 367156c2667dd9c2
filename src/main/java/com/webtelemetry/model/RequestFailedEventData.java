package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A request that never produced a response (DNS failure, abort, CSP/mixed-content block, ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestFailedEventData(String requestId, String error, String blockedReason, Double timestamp) {

    public static RequestFailedEventData of(String requestId, String error) {
        return new RequestFailedEventData(requestId, error, null, null);
    }
}
