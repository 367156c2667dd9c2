package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable envelope for one raw browser signal.
 *
 * Created once per signal by the session and appended to its {@link com.webtelemetry.event.EventLog}.
 * The {@code data} payload is copied on construction and exposed read-only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BrowserEvent {

    private final double timestamp;       // monotonic seconds
    private final EventType eventType;
    private final String source;
    private final Severity severity;
    private final Map<String, Object> data;

    public BrowserEvent(double timestamp, EventType eventType, String source,
                        Severity severity, Map<String, ?> data) {
        this.timestamp = timestamp;
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.source    = source != null ? source : eventType.sourceName();
        this.severity  = severity != null ? severity : Severity.INFO;
        this.data      = data != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
            : Collections.emptyMap();
    }

    public double getTimestamp()          { return timestamp; }
    public EventType getEventType()       { return eventType; }
    public String getSource()             { return source; }
    public Severity getSeverity()         { return severity; }
    public Map<String, Object> getData()  { return data; }

    @Override
    public String toString() {
        return String.format("BrowserEvent{t=%.3f, type=%s, source=%s, severity=%s}",
            timestamp, eventType, source, severity);
    }
}
