package com.webtelemetry.model;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over every terminal (completed or failed) request in a session.
 *
 * Response times are in milliseconds and only cover requests that received a
 * response. {@code compressionRatio} is in [0,1]; {@code performanceScore} in [0,100].
 */
public record NetworkAnalysis(
    int totalRequests,
    int successfulRequests,
    int failedRequests,
    int blockedRequests,
    int cachedRequests,
    int pendingRequests,
    double averageResponseTime,
    List<RequestSummary> slowestRequests,
    List<RequestSummary> fastestRequests,
    Map<String, Integer> resourceTypes,
    Map<String, Integer> domains,
    Map<Integer, Integer> statusCodes,
    long totalBytesTransferred,
    long totalBytesCompressed,
    double compressionRatio,
    List<String> issues,
    List<String> recommendations,
    double performanceScore
) {

    public static NetworkAnalysis empty(int pendingRequests) {
        return new NetworkAnalysis(0, 0, 0, 0, 0, pendingRequests, 0.0, List.of(), List.of(),
            Map.of(), Map.of(), Map.of(), 0L, 0L, 0.0, List.of(), List.of(), 0.0);
    }
}
