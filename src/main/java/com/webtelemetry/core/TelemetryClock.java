package com.webtelemetry.core;

/**
 * Monotonic time source for event timestamps, in seconds.
 *
 * The origin is arbitrary; only differences between readings are meaningful.
 */
@FunctionalInterface
public interface TelemetryClock {

    double nowSeconds();

    static TelemetryClock system() {
        return () -> System.nanoTime() / 1_000_000_000.0;
    }
}
