package com.webtelemetry.performance;

import com.webtelemetry.model.CoreWebVitals;
import com.webtelemetry.model.MemoryUsage;
import com.webtelemetry.model.PerformanceAnalysis;
import com.webtelemetry.model.PerformanceGrade;
import com.webtelemetry.model.PerformanceMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Grades performance snapshots against the Core Web Vitals bands and derives
 * bottlenecks, recommendations and critical issues.
 *
 * Stateless. A value equal to a band's upper bound belongs to that band, so an LCP
 * of exactly 2500 ms is EXCELLENT and one of 4000 ms is GOOD.
 */
public final class PerformanceAnalyzer {

    /** Upper bounds of the EXCELLENT and GOOD bands for one vital. */
    public record Band(double excellent, double good) {}

    static final Band LCP = new Band(2500, 4000);
    static final Band FCP = new Band(1800, 3000);
    static final Band CLS = new Band(0.1, 0.25);

    static final double NO_VITALS_SCORE = 50.0;
    static final double HIGH_MEMORY_PCT = 80.0;
    static final double CRITICAL_MEMORY_PCT = 90.0;
    static final double ELEVATED_AVERAGE_MEMORY_PCT = 60.0;
    static final int MANY_RESOURCES = 100;

    private PerformanceAnalyzer() {}

    public static PerformanceAnalysis analyze(List<PerformanceMetrics> snapshots) {
        CoreWebVitals vitals = coreWebVitals(snapshots);
        double score = overallScore(vitals);

        Double pageLoadTime = latest(snapshots, PerformanceMetrics::getPageLoadTime);
        Double domContentLoaded = latest(snapshots, PerformanceMetrics::getDomContentLoaded);
        Double firstPaint = latest(snapshots, PerformanceMetrics::getFirstPaint);
        Integer totalResources = latest(snapshots, PerformanceMetrics::getResourceCount);
        Double memoryPct = latest(snapshots, m -> m.getMemoryUsage() != null ? m.getMemoryUsage().getUsagePercentage() : null);
        Double averageMemoryPct = averageMemoryUsage(snapshots);

        List<String> bottlenecks = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        List<String> critical = new ArrayList<>();

        if (vitals.lcp() != null && vitals.lcp() > LCP.good()) {
            bottlenecks.add(String.format(Locale.ROOT,
                "Poor Largest Contentful Paint (%.0fms) - main content loads too slowly", vitals.lcp()));
            critical.add("Critical: Largest Contentful Paint exceeds 4 seconds");
        }
        if (vitals.cls() != null && vitals.cls() > CLS.good()) {
            bottlenecks.add(String.format(Locale.ROOT,
                "Poor Cumulative Layout Shift (%.3f) - page layout is unstable", vitals.cls()));
            critical.add("Critical: Cumulative Layout Shift causes poor user experience");
        }
        if (vitals.fcp() != null && vitals.fcp() > FCP.good()) {
            bottlenecks.add(String.format(Locale.ROOT,
                "Slow First Contentful Paint (%.0fms) - initial content appears too late", vitals.fcp()));
        }
        if (memoryPct != null && memoryPct > HIGH_MEMORY_PCT) {
            bottlenecks.add(String.format(Locale.ROOT, "High memory usage (%.1f%%)", memoryPct));
        }
        if (memoryPct != null && memoryPct > CRITICAL_MEMORY_PCT) {
            critical.add("Critical: Memory usage near limit, risk of crashes");
        }

        if (vitals.lcp() != null && vitals.lcp() > LCP.excellent()) {
            recommendations.add("Optimize Largest Contentful Paint: compress images, use a CDN, reduce server response time");
        }
        if (vitals.cls() != null && vitals.cls() > CLS.excellent()) {
            recommendations.add("Fix Cumulative Layout Shift: set image dimensions, avoid inserting content above existing content");
        }
        if (vitals.fcp() != null && vitals.fcp() > FCP.excellent()) {
            recommendations.add("Speed up First Contentful Paint: optimize the critical rendering path, inline critical CSS");
        }
        if (averageMemoryPct != null && averageMemoryPct > ELEVATED_AVERAGE_MEMORY_PCT) {
            recommendations.add("Optimize memory usage: look for leaks and oversized data structures");
        }
        if (totalResources != null && totalResources > MANY_RESOURCES) {
            recommendations.add("Reduce resource count: bundle resources and lazy-load what is not needed up front");
        }

        return new PerformanceAnalysis(
            vitals,
            score,
            overallGrade(score),
            pageLoadTime,
            domContentLoaded,
            firstPaint,
            totalResources,
            memoryPct,
            memoryPct != null ? memoryGrade(memoryPct) : null,
            List.copyOf(bottlenecks),
            List.copyOf(recommendations),
            List.copyOf(critical)
        );
    }

    /** Latest reported value of each vital, graded. */
    static CoreWebVitals coreWebVitals(List<PerformanceMetrics> snapshots) {
        Double lcp = latest(snapshots, PerformanceMetrics::getLargestContentfulPaint);
        Double fcp = latest(snapshots, PerformanceMetrics::getFirstContentfulPaint);
        Double cls = latest(snapshots, PerformanceMetrics::getCumulativeLayoutShift);
        return new CoreWebVitals(
            lcp, lcp != null ? grade(LCP, lcp) : null,
            fcp, fcp != null ? grade(FCP, fcp) : null,
            cls, cls != null ? grade(CLS, cls) : null);
    }

    /**
     * EXCELLENT up to the first bound, GOOD up to the second, POOR beyond. A single
     * vital is never graded NEEDS_IMPROVEMENT; that grade only comes from the
     * averaged score.
     */
    public static PerformanceGrade grade(Band band, double value) {
        if (value <= band.excellent()) return PerformanceGrade.EXCELLENT;
        if (value <= band.good()) return PerformanceGrade.GOOD;
        return PerformanceGrade.POOR;
    }

    /** Mean of 100/75/25 per reported vital; 50 when none was reported. */
    public static double overallScore(CoreWebVitals vitals) {
        List<Double> scores = new ArrayList<>();
        if (vitals.lcp() != null) scores.add(bandScore(LCP, vitals.lcp()));
        if (vitals.cls() != null) scores.add(bandScore(CLS, vitals.cls()));
        if (vitals.fcp() != null) scores.add(bandScore(FCP, vitals.fcp()));
        if (scores.isEmpty()) return NO_VITALS_SCORE;
        return scores.stream().mapToDouble(Double::doubleValue).average().orElse(NO_VITALS_SCORE);
    }

    private static double bandScore(Band band, double value) {
        if (value <= band.excellent()) return 100;
        if (value <= band.good()) return 75;
        return 25;
    }

    /** 90 and above EXCELLENT, 75 GOOD, 50 NEEDS_IMPROVEMENT, below that POOR. */
    public static PerformanceGrade overallGrade(double score) {
        if (score >= 90) return PerformanceGrade.EXCELLENT;
        if (score >= 75) return PerformanceGrade.GOOD;
        if (score >= 50) return PerformanceGrade.NEEDS_IMPROVEMENT;
        return PerformanceGrade.POOR;
    }

    /** Below 50% EXCELLENT, 70% GOOD, 85% NEEDS_IMPROVEMENT, otherwise POOR. */
    public static PerformanceGrade memoryGrade(double usagePercentage) {
        if (usagePercentage < 50) return PerformanceGrade.EXCELLENT;
        if (usagePercentage < 70) return PerformanceGrade.GOOD;
        if (usagePercentage < 85) return PerformanceGrade.NEEDS_IMPROVEMENT;
        return PerformanceGrade.POOR;
    }

    private static Double averageMemoryUsage(List<PerformanceMetrics> snapshots) {
        double sum = 0;
        int samples = 0;
        for (PerformanceMetrics m : snapshots) {
            MemoryUsage memory = m.getMemoryUsage();
            Double pct = memory != null ? memory.getUsagePercentage() : null;
            if (pct != null) {
                sum += pct;
                samples++;
            }
        }
        return samples > 0 ? sum / samples : null;
    }

    static int memorySampleCount(List<PerformanceMetrics> snapshots) {
        int samples = 0;
        for (PerformanceMetrics m : snapshots) {
            if (m.getMemoryUsage() != null && m.getMemoryUsage().getUsagePercentage() != null) samples++;
        }
        return samples;
    }

    private static <T> T latest(List<PerformanceMetrics> snapshots, Function<PerformanceMetrics, T> field) {
        for (int i = snapshots.size() - 1; i >= 0; i--) {
            T value = field.apply(snapshots.get(i));
            if (value != null) return value;
        }
        return null;
    }
}
