package com.webtelemetry.console;

import com.webtelemetry.model.ConsoleLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The built-in console rule table.
 *
 * ## Ordering contract
 * Rules are evaluated top to bottom and every matching rule contributes its name
 * and score, but the message category is taken from the <em>last</em> matching
 * rule. Reordering this list changes classification results.
 */
public final class ConsolePatternCatalog {

    // Categories referenced by the recommendation thresholds
    public static final String JAVASCRIPT_ERROR    = "javascript_error";
    public static final String NETWORK_ERROR       = "network_error";
    public static final String CORS_ERROR          = "cors_error";
    public static final String SECURITY_ERROR      = "security_error";
    public static final String PERFORMANCE_WARNING = "performance_warning";
    public static final String MEMORY_WARNING      = "memory_warning";
    public static final String DEPRECATION_WARNING = "deprecation_warning";
    public static final String FRAMEWORK_WARNING   = "framework_warning";
    public static final String SECURITY_WARNING    = "security_warning";
    public static final String THIRD_PARTY_ERROR   = "third_party_error";
    public static final String DEBUG_MESSAGE       = "debug_message";

    private static final List<ConsolePattern> BUILT_INS = Collections.unmodifiableList(buildBuiltIns());

    private ConsolePatternCatalog() {}

    /** The built-in rules, in evaluation order. */
    public static List<ConsolePattern> builtIns() {
        return BUILT_INS;
    }

    /** Built-ins followed by {@code extra}; extra rules therefore win category ties. */
    public static List<ConsolePattern> withExtras(List<ConsolePattern> extra) {
        List<ConsolePattern> all = new ArrayList<>(BUILT_INS);
        if (extra != null) all.addAll(extra);
        return Collections.unmodifiableList(all);
    }

    private static List<ConsolePattern> buildBuiltIns() {
        List<ConsolePattern> rules = new ArrayList<>();

        // JavaScript and request failures
        rules.add(ConsolePattern.of("uncaught_exception",
            "Uncaught\\s+(TypeError|ReferenceError|SyntaxError|Error)",
            JAVASCRIPT_ERROR, ConsoleLevel.ERROR, "Uncaught JavaScript exception", true));
        rules.add(ConsolePattern.of("network_error",
            "(Failed to load|net::ERR_|NetworkError|fetch.*failed)",
            NETWORK_ERROR, ConsoleLevel.ERROR, "Network request failure", true));
        rules.add(ConsolePattern.of("cors_error",
            "(CORS|Cross-Origin|Access-Control-Allow)",
            CORS_ERROR, ConsoleLevel.ERROR, "CORS policy violation", true));
        rules.add(ConsolePattern.of("csp_violation",
            "Content Security Policy|CSP",
            SECURITY_ERROR, ConsoleLevel.ERROR, "Content Security Policy violation", true));

        // Performance
        rules.add(ConsolePattern.of("performance_warning",
            "(slow|performance|optimization|inefficient)",
            PERFORMANCE_WARNING, ConsoleLevel.WARNING, "Performance-related warning", false));
        rules.add(ConsolePattern.of("memory_warning",
            "(memory|heap|leak|garbage)",
            MEMORY_WARNING, ConsoleLevel.WARNING, "Memory usage warning", false));

        rules.add(ConsolePattern.of("deprecation",
            "(deprecated|deprecation|will be removed)",
            DEPRECATION_WARNING, ConsoleLevel.WARNING, "Deprecated API usage", false));

        // Frameworks
        rules.add(ConsolePattern.of("react_warning",
            "React|Warning.*React",
            FRAMEWORK_WARNING, ConsoleLevel.WARNING, "React framework warning", false));
        rules.add(ConsolePattern.of("vue_warning",
            "Vue warn|Vue\\.js",
            FRAMEWORK_WARNING, ConsoleLevel.WARNING, "Vue.js framework warning", false));
        rules.add(ConsolePattern.of("angular_warning",
            "Angular|ng-",
            FRAMEWORK_WARNING, ConsoleLevel.WARNING, "Angular framework warning", false));

        rules.add(ConsolePattern.of("mixed_content",
            "Mixed Content|insecure.*secure",
            SECURITY_WARNING, ConsoleLevel.WARNING, "Mixed content warning", false));

        rules.add(ConsolePattern.of("third_party_error",
            "(google|facebook|twitter|analytics|gtag|fbq)",
            THIRD_PARTY_ERROR, ConsoleLevel.WARNING, "Third-party service error", false));

        // Least specific, must stay last
        rules.add(ConsolePattern.of("debug_message",
            "(debug|dev|development|console\\.log)",
            DEBUG_MESSAGE, ConsoleLevel.DEBUG, "Development/debug message", false));

        return rules;
    }
}
