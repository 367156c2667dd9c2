package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkTimelineEntry(double timestamp, String url, String method, Integer status,
                                   Double durationMs, Long size, String error) {

    public static NetworkTimelineEntry from(NetworkRequest r) {
        return new NetworkTimelineEntry(r.getRequestTimestamp(), r.getUrl(), r.getMethod(),
            r.getResponseStatus(), r.getDurationMs(), r.getSize(), r.getError());
    }
}
