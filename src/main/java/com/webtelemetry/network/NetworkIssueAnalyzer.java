package com.webtelemetry.network;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns aggregate network figures into issues, recommendations and a 0-100
 * performance score.
 *
 * Stateless; thresholds are fixed. All comparisons are strict, so a failure rate
 * of exactly 10% or an average of exactly 2000 ms does not raise an issue.
 */
public final class NetworkIssueAnalyzer {

    static final double HIGH_FAILURE_RATE = 0.10;
    static final double SLOW_AVERAGE_MS = 2000.0;
    static final double SOFT_SLOW_AVERAGE_MS = 1000.0;
    static final int MAX_DOMAINS = 10;
    static final int HIGH_REQUEST_VOLUME = 100;
    static final int MANY_IMAGES = 20;
    static final int MANY_SCRIPTS = 15;

    private NetworkIssueAnalyzer() {}

    /** Issues and recommendations derived from one analysis pass. */
    public record Findings(List<String> issues, List<String> recommendations) {}

    public static Findings analyze(int totalRequests, int failedRequests, double averageResponseTimeMs,
                                   Map<Integer, Integer> statusCodes, Map<String, Integer> domains,
                                   Map<String, Integer> resourceTypes) {
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        double failureRate = totalRequests > 0 ? (double) failedRequests / totalRequests : 0.0;
        if (failureRate > HIGH_FAILURE_RATE) {
            issues.add(String.format(Locale.ROOT, "High network failure rate: %.1f%% of requests failed", failureRate * 100));
            recommendations.add("Investigate network failures - check API endpoints and server status");
        }

        if (averageResponseTimeMs > SLOW_AVERAGE_MS) {
            issues.add(String.format(Locale.ROOT, "Slow average response time: %.0fms", averageResponseTimeMs));
            recommendations.add("Optimize API response times - consider caching, CDN, or server optimization");
        } else if (averageResponseTimeMs > SOFT_SLOW_AVERAGE_MS) {
            recommendations.add("Consider optimizing response times for better user experience");
        }

        int clientErrors = 0;
        int serverErrors = 0;
        for (Map.Entry<Integer, Integer> e : statusCodes.entrySet()) {
            int status = e.getKey();
            if (status >= 400 && status < 500) clientErrors += e.getValue();
            else if (status >= 500) serverErrors += e.getValue();
        }
        if (clientErrors > 0) {
            issues.add("Client errors detected: " + clientErrors + " requests with 4xx status codes");
            recommendations.add("Review client-side requests - check URLs, parameters, and authentication");
        }
        if (serverErrors > 0) {
            issues.add("Server errors detected: " + serverErrors + " requests with 5xx status codes");
            recommendations.add("Investigate server-side issues - check server logs and health");
        }

        if (domains.size() > MAX_DOMAINS) {
            issues.add("High number of domains: " + domains.size() + " different domains contacted");
            recommendations.add("Consider reducing external dependencies to improve loading performance");
        }

        if (totalRequests > HIGH_REQUEST_VOLUME) {
            recommendations.add("High request volume detected - consider request bundling or optimization");
        }
        if (resourceTypes.getOrDefault("image", 0) > MANY_IMAGES) {
            recommendations.add("Many image requests detected - consider image optimization and lazy loading");
        }
        if (resourceTypes.getOrDefault("script", 0) > MANY_SCRIPTS) {
            recommendations.add("Many script requests detected - consider script bundling and minification");
        }

        return new Findings(List.copyOf(issues), List.copyOf(recommendations));
    }

    /**
     * 40 x success rate, plus 40/30/20/10 for an average under 500/1000/2000 ms
     * or slower, plus 20 x cache rate. Clamped to [0,100].
     */
    public static double performanceScore(double successRate, double averageResponseTimeMs, double cacheRate) {
        double responseScore;
        if (averageResponseTimeMs < 500) {
            responseScore = 40;
        } else if (averageResponseTimeMs < 1000) {
            responseScore = 30;
        } else if (averageResponseTimeMs < 2000) {
            responseScore = 20;
        } else {
            responseScore = 10;
        }
        double score = successRate * 40 + responseScore + cacheRate * 20;
        return Math.max(0.0, Math.min(100.0, score));
    }
}
