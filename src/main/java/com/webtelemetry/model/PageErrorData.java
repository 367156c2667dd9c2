package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Uncaught page error ({@code window.onerror} / {@code pageerror}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageErrorData(String message, String stack, Double timestamp) {

    public static PageErrorData of(String message) {
        return new PageErrorData(message, null, null);
    }
}
