package com.webtelemetry.console;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.webtelemetry.model.ConsoleLevel;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One console classification rule.
 *
 * The regular expression is matched case-insensitively anywhere in the message
 * text. Rules are immutable and stateless, so one instance serves every message.
 *
 * JSON form (as read by {@link ConsolePatternRepository}):
 * <pre>
 *   {
 *     "name": "chunk_load_failure",
 *     "regex": "Loading chunk \\d+ failed",
 *     "category": "network_error",
 *     "severity": "ERROR",
 *     "actionRequired": true,
 *     "description": "Lazy-loaded bundle could not be fetched"
 *   }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConsolePattern {

    private final String name;
    private final Pattern pattern;
    private final String category;
    private final ConsoleLevel severity;
    private final boolean actionRequired;
    private final String description;

    @JsonCreator
    public ConsolePattern(@JsonProperty("name") String name,
                          @JsonProperty("regex") String regex,
                          @JsonProperty("category") String category,
                          @JsonProperty("severity") ConsoleLevel severity,
                          @JsonProperty("actionRequired") boolean actionRequired,
                          @JsonProperty("description") String description) {
        this.name           = requireText(name, "name");
        this.pattern        = Pattern.compile(requireText(regex, "regex"), Pattern.CASE_INSENSITIVE);
        this.category       = requireText(category, "category");
        this.severity       = Objects.requireNonNull(severity, "severity");
        this.actionRequired = actionRequired;
        this.description    = description != null ? description : "";
    }

    public static ConsolePattern of(String name, String regex, String category, ConsoleLevel severity,
                                    String description, boolean actionRequired) {
        return new ConsolePattern(name, regex, category, severity, actionRequired, description);
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }

    public String getName()            { return name; }
    public String getRegex()           { return pattern.pattern(); }
    public String getCategory()        { return category; }
    public ConsoleLevel getSeverity()  { return severity; }
    public boolean isActionRequired()  { return actionRequired; }
    public String getDescription()     { return description; }

    @JsonIgnore
    public int getSeverityScore()      { return severity.getSeverityScore(); }

    @Override
    public String toString() {
        return String.format("ConsolePattern{name='%s', category=%s, severity=%s, action=%b}",
            name, category, severity, actionRequired);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ConsolePattern." + field + " is required");
        }
        return value;
    }
}
