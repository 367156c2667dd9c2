package com.webtelemetry.diagnostics;

/**
 * Sink for the diagnostics emitted while ingesting and analysing telemetry.
 *
 * Injected into every monitor so tests can assert on what was reported without
 * capturing global log output. Implementations must not throw.
 */
@FunctionalInterface
public interface TelemetryDiagnostics {

    void emit(Diagnostic diagnostic);

    /** The default sink: writes every diagnostic through SLF4J. */
    static TelemetryDiagnostics slf4j() {
        return new Slf4jTelemetryDiagnostics();
    }
}
