package com.webtelemetry.diagnostics;

/**
 * Every diagnostic the engine can emit. None of them abort a session.
 */
public enum DiagnosticCode {
    /** Response or failure arrived for a request id that is not pending. */
    CORRELATION_MISS,
    /** A request id was reused while the earlier request was still pending. */
    DUPLICATE_REQUEST_ID,
    /** A console message scored at error level on ingestion. */
    CRITICAL_CONSOLE_ISSUE,
    /** A request terminated without a response. */
    REQUEST_FAILED,
    /** The performance probe threw or returned nothing. */
    SNAPSHOT_FAILED,
    /** A registered event listener threw. */
    LISTENER_FAILED,
    /** A browser log entry could not be read or decoded. */
    LOG_DECODE_FAILED,
    /** The console pattern file could not be read. */
    PATTERN_LOAD_FAILED,
    /** An instrumentation payload carried values that could not be bound; they were dropped. */
    PAYLOAD_DECODE_FAILED
}
