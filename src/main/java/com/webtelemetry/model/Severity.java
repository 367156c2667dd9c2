package com.webtelemetry.model;

/**
 * Severity attached to every {@link BrowserEvent}.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO,
    DEBUG;

    /**
     * Maps a console level onto the event severity used in the session timeline.
     * error/assert are errors, warning is a warning, everything else is info.
     */
    public static Severity fromConsoleLevel(ConsoleLevel level) {
        if (level == null) return INFO;
        switch (level) {
            case ERROR:
            case ASSERT:
                return ERROR;
            case WARNING:
                return WARNING;
            default:
                return INFO;
        }
    }
}
