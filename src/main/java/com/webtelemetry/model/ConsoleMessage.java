package com.webtelemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One console message or page error, enriched with its classification.
 *
 * Instances never change. {@link #withRule} returns a reclassified copy whose
 * {@code severityScore} is never lower and whose {@code actionRequired} is never
 * cleared.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsoleMessage {

    public static final String UNCATEGORIZED = "uncategorized";

    // ── Raw ───────────────────────────────────────────────────────────────────
    private final double timestamp;
    private final double relativeTime;
    private final ConsoleLevel level;
    private final String text;
    private final ConsoleLocation location;
    private final String stackTrace;

    // ── Classification ────────────────────────────────────────────────────────
    private final String category;
    private final int severityScore;
    private final Set<String> patternsMatched;
    private final boolean actionRequired;

    public ConsoleMessage(double timestamp, double relativeTime, ConsoleLevel level, String text,
                          ConsoleLocation location, String stackTrace) {
        this.timestamp       = timestamp;
        this.relativeTime    = relativeTime;
        this.level           = level != null ? level : ConsoleLevel.INFO;
        this.text            = text != null ? text : "";
        this.location        = location;
        this.stackTrace      = stackTrace;
        this.category        = UNCATEGORIZED;
        this.severityScore   = 0;
        this.patternsMatched = Set.of();
        this.actionRequired  = false;
    }

    private ConsoleMessage(ConsoleMessage base, String category, int severityScore,
                           Set<String> patternsMatched, boolean actionRequired) {
        this.timestamp       = base.timestamp;
        this.relativeTime    = base.relativeTime;
        this.level           = base.level;
        this.text            = base.text;
        this.location        = base.location;
        this.stackTrace      = base.stackTrace;
        this.category        = category;
        this.severityScore   = severityScore;
        this.patternsMatched = Collections.unmodifiableSet(patternsMatched);
        this.actionRequired  = actionRequired;
    }

    /**
     * Returns a copy that records a matching rule. Category follows the latest
     * match; the score is raised to the rule's score if higher.
     */
    public ConsoleMessage withRule(String ruleName, String ruleCategory, int ruleScore, boolean ruleActionRequired) {
        Set<String> matched = new LinkedHashSet<>(patternsMatched);
        matched.add(ruleName);
        return new ConsoleMessage(this, ruleCategory, Math.max(severityScore, ruleScore),
            matched, actionRequired || ruleActionRequired);
    }

    public boolean isCritical() {
        return actionRequired || severityScore >= ConsoleLevel.ERROR.getSeverityScore();
    }

    public double getTimestamp()            { return timestamp; }
    public double getRelativeTime()         { return relativeTime; }
    public ConsoleLevel getLevel()          { return level; }
    public String getText()                 { return text; }
    public ConsoleLocation getLocation()    { return location; }
    public String getStackTrace()           { return stackTrace; }
    public String getCategory()             { return category; }
    public int getSeverityScore()           { return severityScore; }
    public Set<String> getPatternsMatched() { return patternsMatched; }
    public boolean isActionRequired()       { return actionRequired; }

    @Override
    public String toString() {
        return String.format("ConsoleMessage{level=%s, category=%s, score=%d, text='%s'}",
            level, category, severityScore, abbreviate(text, 60));
    }

    /** Cuts text to {@code max} chars and appends "..." when it was longer. */
    public static String abbreviate(String text, int max) {
        if (text == null) return "";
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
