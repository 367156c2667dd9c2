package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * A request observed leaving the page.
 *
 * {@code requestId} is the correlation key for the later response or failure.
 * When null the monitor mints one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestEventData(
    String requestId,
    String url,
    String method,
    Map<String, String> headers,
    String resourceType,
    Map<String, Object> initiator,
    String postData,
    Double timestamp
) {

    public static RequestEventData of(String requestId, String url, String method, String resourceType) {
        return new RequestEventData(requestId, url, method, null, resourceType, null, null, null);
    }

    public RequestEventData at(double timestamp) {
        return new RequestEventData(requestId, url, method, headers, resourceType, initiator, postData, timestamp);
    }
}
