package com.webtelemetry.model;

/**
 * Lifecycle of a {@link NetworkRequest}. PENDING moves exactly once to a terminal state.
 */
public enum RequestState {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() { return this != PENDING; }
}
