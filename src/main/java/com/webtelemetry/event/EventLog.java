package com.webtelemetry.event;

import com.webtelemetry.core.TelemetryClock;
import com.webtelemetry.model.BrowserEvent;
import com.webtelemetry.model.EventType;
import com.webtelemetry.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Append-only session timeline of {@link BrowserEvent}s in arrival order.
 *
 * Keeps the most recent {@code capacity} events; older ones are evicted but still
 * counted by {@link #totalRecorded()}. Recording never fails for a non-null type.
 */
public class EventLog {

    private final int capacity;
    private final TelemetryClock clock;
    private final ConcurrentLinkedDeque<BrowserEvent> events = new ConcurrentLinkedDeque<>();
    private final AtomicLong recorded = new AtomicLong();

    public EventLog(int capacity, TelemetryClock clock) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.clock = clock;
    }

    // ── Recording ─────────────────────────────────────────────────────────────

    public BrowserEvent record(EventType eventType, Map<String, ?> data) {
        return record(eventType, null, data, Severity.INFO);
    }

    public BrowserEvent record(EventType eventType, Map<String, ?> data, Severity severity) {
        return record(eventType, null, data, severity);
    }

    /**
     * Appends one event stamped with the current clock reading.
     *
     * @param source defaults to the lower-case event type when null
     */
    public BrowserEvent record(EventType eventType, String source, Map<String, ?> data, Severity severity) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType is required");
        }
        BrowserEvent event = new BrowserEvent(clock.nowSeconds(), eventType, source, severity, data);
        append(event);
        return event;
    }

    private void append(BrowserEvent event) {
        events.addLast(event);
        recorded.incrementAndGet();
        while (events.size() > capacity) {
            events.pollFirst();
        }
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    /** All retained events, oldest first. */
    public List<BrowserEvent> all() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /** The last {@code n} retained events, oldest first. */
    public List<BrowserEvent> recent(int n) {
        List<BrowserEvent> snapshot = new ArrayList<>(events);
        if (n <= 0) return List.of();
        int from = Math.max(0, snapshot.size() - n);
        return Collections.unmodifiableList(snapshot.subList(from, snapshot.size()));
    }

    /** Retained events with a timestamp at or after {@code timestamp}. */
    public List<BrowserEvent> since(double timestamp) {
        return events.stream()
            .filter(e -> e.getTimestamp() >= timestamp)
            .collect(Collectors.toUnmodifiableList());
    }

    public List<BrowserEvent> ofType(EventType type) {
        return events.stream()
            .filter(e -> e.getEventType() == type)
            .collect(Collectors.toUnmodifiableList());
    }

    /** Number of events currently retained. */
    public int size() {
        return events.size();
    }

    /** Number of events ever recorded, including evicted ones. */
    public long totalRecorded() {
        return recorded.get();
    }

    public int getCapacity() {
        return capacity;
    }
}
