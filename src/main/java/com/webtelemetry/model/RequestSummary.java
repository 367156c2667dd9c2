package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Compact description of a timed request, used in slowest/fastest rankings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestSummary(String url, String method, Double durationMs, Integer status,
                             Long size, boolean cacheHit) {

    public static RequestSummary from(NetworkRequest request) {
        return new RequestSummary(request.getUrl(), request.getMethod(), request.getDurationMs(),
            request.getResponseStatus(), request.getSize(), request.isCacheHit());
    }
}
