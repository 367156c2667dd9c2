package com.webtelemetry.performance;

import java.util.Map;

/**
 * Source of raw page-timing figures, normally a script run in the browser.
 *
 * Implementations may block. A null return or any exception is treated as
 * "nothing could be measured" by {@link PerformanceSnapshotAssembler}.
 */
@FunctionalInterface
public interface PerformanceProbe {

    Map<String, Object> collect() throws Exception;
}
