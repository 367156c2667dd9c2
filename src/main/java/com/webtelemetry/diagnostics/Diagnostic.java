package com.webtelemetry.diagnostics;

import com.webtelemetry.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured diagnostic emitted by an engine component.
 *
 * @param code       what happened
 * @param severity   WARNING for degraded data, INFO/DEBUG for expected noise
 * @param source     simple name of the emitting component, e.g. "NetworkMonitor"
 * @param message    human readable text
 * @param attributes structured details (request id, url, ...)
 */
public record Diagnostic(DiagnosticCode code, Severity severity, String source, String message,
                         Map<String, Object> attributes) {

    public Diagnostic {
        attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
    }

    public static Diagnostic warning(DiagnosticCode code, String source, String message, Map<String, Object> attributes) {
        return new Diagnostic(code, Severity.WARNING, source, message, attributes);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
