package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Core Web Vitals of the session: the latest reported value of each vital and its
 * grade. A vital the browser never reported is null, as is its grade.
 *
 * @param lcp largest contentful paint, ms
 * @param fcp first contentful paint, ms
 * @param cls cumulative layout shift, unitless
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoreWebVitals(
    Double lcp,
    PerformanceGrade lcpGrade,
    Double fcp,
    PerformanceGrade fcpGrade,
    Double cls,
    PerformanceGrade clsGrade
) {

    public static CoreWebVitals none() {
        return new CoreWebVitals(null, null, null, null, null, null);
    }
}
