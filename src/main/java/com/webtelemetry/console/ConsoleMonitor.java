package com.webtelemetry.console;

import com.webtelemetry.core.TelemetryClock;
import com.webtelemetry.core.TelemetryConfig;
import com.webtelemetry.diagnostics.Diagnostic;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.diagnostics.TelemetryDiagnostics;
import com.webtelemetry.model.CategorySummary;
import com.webtelemetry.model.ConsoleAnalysis;
import com.webtelemetry.model.ConsoleEventData;
import com.webtelemetry.model.ConsoleLevel;
import com.webtelemetry.model.ConsoleMessage;
import com.webtelemetry.model.ConsoleSummary;
import com.webtelemetry.model.ConsoleTimelineEntry;
import com.webtelemetry.model.CriticalIssue;
import com.webtelemetry.model.PageErrorData;
import com.webtelemetry.model.PatternFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies console output and page errors against an ordered rule list and
 * produces the console analysis for a session.
 *
 * ## Classification
 * Every rule whose regex matches the message text is applied in list order:
 * its name is recorded, the category becomes the rule's category (last match
 * wins) and the severity score is raised to the rule's score. A message that
 * reaches the error score is reported as a critical issue immediately.
 *
 * ## Thread Safety
 * All state is guarded by the monitor's intrinsic lock; ingestion and analysis
 * may be called from different threads.
 */
public class ConsoleMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConsoleMonitor.class);

    static final int TEXT_PREVIEW_CHARS = 100;
    static final int CATEGORY_SAMPLE_SIZE = 10;
    static final int DEBUG_MESSAGE_THRESHOLD = 5;
    static final int HIGH_ERROR_VOLUME_THRESHOLD = 10;

    private final List<ConsolePattern> patterns;
    private final TelemetryClock clock;
    private final TelemetryDiagnostics diagnostics;
    private final int criticalIssueLimit;
    private final int timelineSize;
    private final double startTime;

    private final List<ConsoleMessage> messages = new ArrayList<>();
    private final Map<String, List<ConsoleMessage>> byCategory = new LinkedHashMap<>();

    public ConsoleMonitor() {
        this(ConsolePatternCatalog.builtIns(), TelemetryClock.system(), TelemetryDiagnostics.slf4j(),
            TelemetryConfig.defaults());
    }

    public ConsoleMonitor(List<ConsolePattern> patterns, TelemetryClock clock,
                          TelemetryDiagnostics diagnostics, TelemetryConfig config) {
        this.patterns           = List.copyOf(patterns);
        this.clock              = clock;
        this.diagnostics        = diagnostics;
        this.criticalIssueLimit = config.getCriticalIssueLimit();
        this.timelineSize       = config.getTimelineSize();
        this.startTime          = clock.nowSeconds();
    }

    // ── Ingestion ─────────────────────────────────────────────────────────────

    /**
     * Wraps, classifies and stores one console message.
     *
     * @return the classified message
     */
    public ConsoleMessage addMessage(ConsoleEventData raw) {
        ConsoleEventData data = raw != null ? raw : new ConsoleEventData(null, null, null, null, null);
        double timestamp = data.timestamp() != null ? data.timestamp() : clock.nowSeconds();
        ConsoleMessage message = new ConsoleMessage(timestamp, timestamp - startTime,
            ConsoleLevel.parse(data.level()), data.text(), data.location(), data.stackTrace());
        return ingest(message);
    }

    /**
     * Stores an uncaught page error as an error-level console message.
     */
    public ConsoleMessage addPageError(PageErrorData raw) {
        PageErrorData data = raw != null ? raw : new PageErrorData(null, null, null);
        double timestamp = data.timestamp() != null ? data.timestamp() : clock.nowSeconds();
        ConsoleMessage message = new ConsoleMessage(timestamp, timestamp - startTime,
            ConsoleLevel.ERROR, data.message(), null, data.stack());
        return ingest(message);
    }

    private ConsoleMessage ingest(ConsoleMessage raw) {
        ConsoleMessage message = classify(raw);
        synchronized (this) {
            messages.add(message);
            byCategory.computeIfAbsent(message.getCategory(), k -> new ArrayList<>()).add(message);
        }

        if (message.getSeverityScore() >= ConsoleLevel.ERROR.getSeverityScore()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("category", message.getCategory());
            attributes.put("patterns", List.copyOf(message.getPatternsMatched()));
            diagnostics.emit(Diagnostic.warning(DiagnosticCode.CRITICAL_CONSOLE_ISSUE, "ConsoleMonitor",
                "Critical console issue detected: " + ConsoleMessage.abbreviate(message.getText(), TEXT_PREVIEW_CHARS),
                attributes));
        } else {
            log.debug("ConsoleMonitor: {} [{}] {}", message.getLevel(), message.getCategory(),
                ConsoleMessage.abbreviate(message.getText(), TEXT_PREVIEW_CHARS));
        }
        return message;
    }

    private ConsoleMessage classify(ConsoleMessage message) {
        String text = message.getText();
        ConsoleMessage classified = message;
        for (ConsolePattern pattern : patterns) {
            if (pattern.matches(text)) {
                classified = classified.withRule(pattern.getName(), pattern.getCategory(),
                    pattern.getSeverityScore(), pattern.isActionRequired());
            }
        }
        return classified;
    }

    // ── Analysis ──────────────────────────────────────────────────────────────

    /**
     * Recomputes the console analysis from the stored messages.
     * Returns {@link ConsoleAnalysis#empty()} when nothing was recorded.
     */
    public synchronized ConsoleAnalysis getAnalysis() {
        if (messages.isEmpty()) {
            return ConsoleAnalysis.empty();
        }

        int errors = 0, warnings = 0, info = 0;
        long totalSeverity = 0;
        Map<String, Integer> patternCounts = new LinkedHashMap<>();
        for (ConsoleMessage msg : messages) {
            switch (msg.getLevel()) {
                case ERROR:   errors++;   break;
                case WARNING: warnings++; break;
                case INFO:
                case LOG:     info++;     break;
                default:                  break;
            }
            totalSeverity += msg.getSeverityScore();
            for (String name : msg.getPatternsMatched()) {
                patternCounts.merge(name, 1, Integer::sum);
            }
        }

        Map<String, Integer> categories = categoryCounts();

        List<String> criticalIssues = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0 && criticalIssues.size() < criticalIssueLimit; i--) {
            ConsoleMessage msg = messages.get(i);
            if (msg.isCritical()) {
                criticalIssues.add(ConsoleMessage.abbreviate(msg.getText(), TEXT_PREVIEW_CHARS));
            }
        }

        List<PatternFrequency> patternsDetected = new ArrayList<>();
        patternCounts.forEach((name, count) -> patternsDetected.add(new PatternFrequency(name, count)));
        patternsDetected.sort(Comparator.comparingInt(PatternFrequency::count).reversed()
            .thenComparing(PatternFrequency::pattern));

        return new ConsoleAnalysis(
            messages.size(),
            errors,
            warnings,
            info,
            Collections.unmodifiableMap(categories),
            List.copyOf(criticalIssues),
            List.copyOf(patternsDetected),
            generateRecommendations(categories),
            (double) totalSeverity / messages.size()
        );
    }

    private Map<String, Integer> categoryCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        byCategory.forEach((category, list) -> counts.put(category, list.size()));
        return counts;
    }

    private List<String> generateRecommendations(Map<String, Integer> categories) {
        List<String> recommendations = new ArrayList<>();

        int jsErrors = categories.getOrDefault(ConsolePatternCatalog.JAVASCRIPT_ERROR, 0);
        int networkErrors = categories.getOrDefault(ConsolePatternCatalog.NETWORK_ERROR, 0);

        if (jsErrors > 0) {
            recommendations.add("Fix " + jsErrors + " JavaScript error(s) to improve application stability");
        }
        if (networkErrors > 0) {
            recommendations.add("Investigate " + networkErrors
                + " network failure(s) - check API endpoints and connectivity");
        }
        if (categories.getOrDefault(ConsolePatternCatalog.CORS_ERROR, 0) > 0) {
            recommendations.add("Configure CORS headers properly to resolve cross-origin request issues");
        }
        if (categories.getOrDefault(ConsolePatternCatalog.PERFORMANCE_WARNING, 0) > 0) {
            recommendations.add("Address performance warnings to improve user experience");
        }
        if (categories.getOrDefault(ConsolePatternCatalog.SECURITY_ERROR, 0) > 0
                || categories.getOrDefault(ConsolePatternCatalog.SECURITY_WARNING, 0) > 0) {
            recommendations.add("Review and fix security-related issues (CSP violations, mixed content)");
        }
        if (categories.getOrDefault(ConsolePatternCatalog.DEPRECATION_WARNING, 0) > 0) {
            recommendations.add("Update deprecated API usage to prevent future compatibility issues");
        }
        if (categories.getOrDefault(ConsolePatternCatalog.FRAMEWORK_WARNING, 0) > 0) {
            recommendations.add("Address framework-specific warnings to ensure optimal performance");
        }
        if (categories.getOrDefault(ConsolePatternCatalog.DEBUG_MESSAGE, 0) > DEBUG_MESSAGE_THRESHOLD) {
            recommendations.add("Remove debug/development console messages from production code");
        }
        if (jsErrors + networkErrors > HIGH_ERROR_VOLUME_THRESHOLD) {
            recommendations.add("High error volume detected - prioritize error resolution for better user experience");
        }
        return List.copyOf(recommendations);
    }

    /**
     * Every message that is action-required or scored at error level, newest first.
     */
    public synchronized List<CriticalIssue> getCriticalIssues() {
        List<CriticalIssue> critical = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConsoleMessage msg = messages.get(i);
            if (msg.isCritical()) {
                critical.add(CriticalIssue.from(msg));
            }
        }
        // Stable sort keeps reverse arrival order for equal timestamps
        critical.sort(Comparator.comparingDouble(CriticalIssue::timestamp).reversed());
        return List.copyOf(critical);
    }

    /**
     * Detail for one category; an unknown category yields an empty summary.
     */
    public synchronized CategorySummary getCategorySummary(String category) {
        List<ConsoleMessage> list = byCategory.get(category);
        if (list == null || list.isEmpty()) {
            return CategorySummary.empty(category);
        }
        double first = Double.MAX_VALUE;
        double last = -Double.MAX_VALUE;
        Set<String> unique = new HashSet<>();
        for (ConsoleMessage msg : list) {
            first = Math.min(first, msg.getTimestamp());
            last = Math.max(last, msg.getTimestamp());
            unique.add(msg.getText());
        }
        List<ConsoleMessage> sample = list.subList(Math.max(0, list.size() - CATEGORY_SAMPLE_SIZE), list.size());
        return new CategorySummary(category, list.size(), List.copyOf(sample), first, last, unique.size());
    }

    /**
     * Analysis plus per-category detail, critical issues and the most recent
     * messages, ready to be serialized into a report.
     */
    public synchronized ConsoleSummary exportSummary() {
        ConsoleAnalysis analysis = getAnalysis();

        Map<String, CategorySummary> categories = new LinkedHashMap<>();
        for (String category : byCategory.keySet()) {
            categories.put(category, getCategorySummary(category));
        }

        List<ConsoleMessage> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparingDouble(ConsoleMessage::getTimestamp));
        List<ConsoleTimelineEntry> timeline = new ArrayList<>();
        for (ConsoleMessage msg : ordered.subList(Math.max(0, ordered.size() - timelineSize), ordered.size())) {
            timeline.add(new ConsoleTimelineEntry(msg.getTimestamp(), msg.getRelativeTime(), msg.getLevel(),
                msg.getCategory(), ConsoleMessage.abbreviate(msg.getText(), TEXT_PREVIEW_CHARS)));
        }

        return new ConsoleSummary(
            clock.nowSeconds() - startTime,
            analysis,
            Collections.unmodifiableMap(categories),
            getCriticalIssues(),
            List.copyOf(timeline)
        );
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    /** Snapshot of all messages in arrival order. */
    public synchronized List<ConsoleMessage> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public List<ConsolePattern> getPatterns() {
        return patterns;
    }
}
