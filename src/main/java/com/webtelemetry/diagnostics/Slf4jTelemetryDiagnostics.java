package com.webtelemetry.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostics to the SLF4J logger {@code com.webtelemetry.diagnostics}, at the
 * level matching the diagnostic's severity.
 */
public class Slf4jTelemetryDiagnostics implements TelemetryDiagnostics {

    private static final Logger log = LoggerFactory.getLogger("com.webtelemetry.diagnostics");

    @Override
    public void emit(Diagnostic d) {
        if (d == null) return;
        switch (d.severity()) {
            case ERROR:
                log.error("{}: [{}] {} {}", d.source(), d.code(), d.message(), d.attributes());
                break;
            case WARNING:
                log.warn("{}: [{}] {} {}", d.source(), d.code(), d.message(), d.attributes());
                break;
            case INFO:
                log.info("{}: [{}] {} {}", d.source(), d.code(), d.message(), d.attributes());
                break;
            default:
                log.debug("{}: [{}] {} {}", d.source(), d.code(), d.message(), d.attributes());
        }
    }
}
