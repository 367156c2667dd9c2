package com.webtelemetry.model;

/**
 * The kind of browser signal a {@link BrowserEvent} was created from.
 */
public enum EventType {
    CONSOLE,
    NETWORK,
    PERFORMANCE,
    ERROR,
    INTERACTION,
    NAVIGATION;

    /** Lower-case name used as the default event source, e.g. "console". */
    public String sourceName() {
        return name().toLowerCase();
    }
}
