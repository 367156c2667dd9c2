package com.webtelemetry.model;

/**
 * How many messages a console rule matched.
 */
public record PatternFrequency(String pattern, int count) {

    @Override
    public String toString() {
        return pattern + " (" + count + "x)";
    }
}
