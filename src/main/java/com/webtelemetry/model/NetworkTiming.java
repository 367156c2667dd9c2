package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Phase breakdown of one completed request, in milliseconds.
 * Each phase is null when the instrumentation did not supply it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkTiming(
    Double dnsLookup,
    Double tcpConnect,
    Double tlsHandshake,
    Double requestSent,
    Double waiting,
    Double contentDownload,
    Double totalTime
) {

    public static NetworkTiming empty() {
        return new NetworkTiming(null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return dnsLookup == null && tcpConnect == null && tlsHandshake == null
            && requestSent == null && waiting == null && contentDownload == null && totalTime == null;
    }
}
