package com.webtelemetry.event;

import com.webtelemetry.model.BrowserEvent;

/**
 * Callback notified after an event of a subscribed type has been recorded.
 *
 * Runs on the ingesting thread. A listener that throws is reported as a
 * diagnostic and does not affect ingestion or other listeners.
 */
@FunctionalInterface
public interface BrowserEventListener {

    void onEvent(BrowserEvent event);
}
