package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;
import java.util.Map;

/**
 * Response headers received for a previously observed request.
 *
 * {@code fromCache} is the instrumentation's free-form cache indicator; it counts
 * as a cache hit when it is "true" or mentions "from-cache".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseEventData(
    Integer status,
    Map<String, String> headers,
    Long size,
    Long compressedSize,
    String fromCache,
    Boolean fromDiskCache,
    Boolean fromMemoryCache,
    Boolean fromServiceWorker,
    NetworkTiming timing,
    Double timestamp
) {

    public static ResponseEventData of(int status) {
        return new ResponseEventData(status, null, null, null, null, null, null, null, null, null);
    }

    public ResponseEventData at(double timestamp) {
        return new ResponseEventData(status, headers, size, compressedSize, fromCache,
            fromDiskCache, fromMemoryCache, fromServiceWorker, timing, timestamp);
    }

    public ResponseEventData withSizes(Long size, Long compressedSize) {
        return new ResponseEventData(status, headers, size, compressedSize, fromCache,
            fromDiskCache, fromMemoryCache, fromServiceWorker, timing, timestamp);
    }

    public ResponseEventData withDiskCache(boolean diskCache) {
        return new ResponseEventData(status, headers, size, compressedSize, fromCache,
            diskCache, fromMemoryCache, fromServiceWorker, timing, timestamp);
    }

    /** Any of: cache indicator says from-cache, disk cache flag, memory cache flag. */
    public boolean isCacheHit() {
        boolean indicator = false;
        if (fromCache != null) {
            String v = fromCache.trim().toLowerCase(Locale.ROOT);
            indicator = "true".equals(v) || v.contains("from-cache");
        }
        return indicator || Boolean.TRUE.equals(fromDiskCache) || Boolean.TRUE.equals(fromMemoryCache);
    }
}
