package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Source position of a console message, when the browser reports one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsoleLocation(String url, Integer lineNumber, Integer columnNumber) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(url != null ? url : "unknown");
        if (lineNumber != null) sb.append(':').append(lineNumber);
        if (columnNumber != null) sb.append(':').append(columnNumber);
        return sb.toString();
    }
}
