package com.webtelemetry.model;

/**
 * Coarse rating of a page-performance figure, best first.
 */
public enum PerformanceGrade {
    EXCELLENT,
    GOOD,
    NEEDS_IMPROVEMENT,
    POOR
}
