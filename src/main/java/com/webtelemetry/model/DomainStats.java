package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Per-domain rollup of terminal requests. Response-time fields are null when no
 * request to the domain received a response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainStats(
    String domain,
    int totalRequests,
    int successfulRequests,
    int failedRequests,
    long totalBytes,
    Double averageResponseTime,
    Double minResponseTime,
    Double maxResponseTime,
    double successRate,
    Map<String, Integer> resourceTypes,
    Map<Integer, Integer> statusCodes
) {
}
