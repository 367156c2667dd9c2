package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One page-timing snapshot, normally taken once per navigation.
 *
 * Every measurement is optional: null means the browser could not measure it,
 * while 0 is a real measurement. Use the Builder for construction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PerformanceMetrics {

    private double timestamp;
    private Double pageLoadTime;
    private Double domContentLoaded;
    private Double firstPaint;
    private Double firstContentfulPaint;
    private Double largestContentfulPaint;
    private Double cumulativeLayoutShift;
    private MemoryUsage memoryUsage;
    private Integer resourceCount;

    private PerformanceMetrics() {}

    /** A snapshot where nothing could be measured. */
    public static PerformanceMetrics absent(double timestamp) {
        return builder().timestamp(timestamp).build();
    }

    public double getTimestamp()               { return timestamp; }
    public Double getPageLoadTime()            { return pageLoadTime; }
    public Double getDomContentLoaded()        { return domContentLoaded; }
    public Double getFirstPaint()              { return firstPaint; }
    public Double getFirstContentfulPaint()    { return firstContentfulPaint; }
    public Double getLargestContentfulPaint()  { return largestContentfulPaint; }
    public Double getCumulativeLayoutShift()   { return cumulativeLayoutShift; }
    public MemoryUsage getMemoryUsage()        { return memoryUsage; }
    public Integer getResourceCount()          { return resourceCount; }

    @JsonIgnore
    public boolean isEmpty() {
        return pageLoadTime == null && domContentLoaded == null && firstPaint == null
            && firstContentfulPaint == null && largestContentfulPaint == null
            && cumulativeLayoutShift == null && memoryUsage == null && resourceCount == null;
    }

    @Override
    public String toString() {
        return String.format("PerformanceMetrics{t=%.3f, load=%s, dcl=%s, fcp=%s, lcp=%s, cls=%s, resources=%s}",
            timestamp, pageLoadTime, domContentLoaded, firstContentfulPaint,
            largestContentfulPaint, cumulativeLayoutShift, resourceCount);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final PerformanceMetrics metrics = new PerformanceMetrics();

        public Builder timestamp(double t)                   { metrics.timestamp = t; return this; }
        public Builder pageLoadTime(Double v)                { metrics.pageLoadTime = v; return this; }
        public Builder domContentLoaded(Double v)            { metrics.domContentLoaded = v; return this; }
        public Builder firstPaint(Double v)                  { metrics.firstPaint = v; return this; }
        public Builder firstContentfulPaint(Double v)        { metrics.firstContentfulPaint = v; return this; }
        public Builder largestContentfulPaint(Double v)      { metrics.largestContentfulPaint = v; return this; }
        public Builder cumulativeLayoutShift(Double v)       { metrics.cumulativeLayoutShift = v; return this; }
        public Builder memoryUsage(MemoryUsage v)            { metrics.memoryUsage = v; return this; }
        public Builder resourceCount(Integer v)              { metrics.resourceCount = v; return this; }

        public PerformanceMetrics build() { return metrics; }
    }
}
