package com.webtelemetry.console;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webtelemetry.diagnostics.Diagnostic;
import com.webtelemetry.diagnostics.DiagnosticCode;
import com.webtelemetry.diagnostics.TelemetryDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads project-specific console patterns from a JSON file.
 *
 * The file holds a JSON array of pattern objects (see {@link ConsolePattern}).
 * Entries with {@code "enabled": false} are skipped. An entry with a missing field,
 * an invalid regex or a name already used by a built-in rule is skipped and
 * reported; the remaining entries still load. A missing or unreadable file yields
 * an empty list.
 *
 * Loaded rules are evaluated after the built-ins, in file order.
 */
public class ConsolePatternRepository {

    private static final Logger log = LoggerFactory.getLogger(ConsolePatternRepository.class);

    private final Path storePath;
    private final ObjectMapper mapper;
    private final TelemetryDiagnostics diagnostics;

    public ConsolePatternRepository(Path storePath, TelemetryDiagnostics diagnostics) {
        this.storePath = storePath;
        this.mapper = new ObjectMapper();
        this.diagnostics = diagnostics;
    }

    /**
     * Reads the file and returns the valid, enabled patterns in file order.
     */
    public List<ConsolePattern> load() {
        if (storePath == null || !Files.exists(storePath)) {
            log.info("ConsolePatternRepository: no pattern file at {} -- using built-in patterns only", storePath);
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = mapper.readTree(storePath.toFile());
        } catch (IOException e) {
            report("Failed to read pattern file: " + e.getMessage(), Map.of("path", storePath.toString()));
            return Collections.emptyList();
        }
        if (root == null || !root.isArray()) {
            report("Pattern file must contain a JSON array", Map.of("path", storePath.toString()));
            return Collections.emptyList();
        }

        Set<String> taken = new HashSet<>();
        ConsolePatternCatalog.builtIns().forEach(p -> taken.add(p.getName()));

        List<ConsolePattern> loaded = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            int position = index++;
            if (node.has("enabled") && !node.get("enabled").asBoolean(true)) {
                log.debug("ConsolePatternRepository: skipping disabled pattern at index {}", position);
                continue;
            }
            try {
                ConsolePattern pattern = mapper.treeToValue(node, ConsolePattern.class);
                if (!taken.add(pattern.getName())) {
                    report("Duplicate pattern name '" + pattern.getName() + "'",
                        Map.of("path", storePath.toString(), "index", position));
                    continue;
                }
                loaded.add(pattern);
            } catch (Exception e) {
                report("Invalid pattern: " + rootCause(e).getMessage(),
                    Map.of("path", storePath.toString(), "index", position));
            }
        }

        log.info("ConsolePatternRepository: loaded {} pattern(s) from {}", loaded.size(), storePath);
        return Collections.unmodifiableList(loaded);
    }

    public Path getStorePath() { return storePath; }

    private void report(String message, Map<String, Object> attributes) {
        diagnostics.emit(Diagnostic.warning(DiagnosticCode.PATTERN_LOAD_FAILED,
            "ConsolePatternRepository", message, attributes));
    }

    private static Throwable rootCause(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }
}
