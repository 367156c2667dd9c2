package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JavaScript heap figures reported by {@code performance.memory}, in bytes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryUsage(Long usedJsHeapSize, Long totalJsHeapSize, Long jsHeapSizeLimit) {

    /** used / limit as a percentage, or null when either figure is missing or the limit is zero. */
    public Double getUsagePercentage() {
        if (usedJsHeapSize == null || jsHeapSizeLimit == null || jsHeapSizeLimit == 0) return null;
        return usedJsHeapSize * 100.0 / jsHeapSizeLimit;
    }
}
