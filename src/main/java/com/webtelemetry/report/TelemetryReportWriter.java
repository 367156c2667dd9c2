package com.webtelemetry.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webtelemetry.core.BrowserTelemetrySession;
import com.webtelemetry.model.SessionExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes session exports as pretty-printed JSON reports.
 *
 * One file per session, named {@code telemetry-<sessionId>.json}, written to a
 * temporary sibling and renamed into place so readers never see a partial report.
 */
public class TelemetryReportWriter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryReportWriter.class);

    private final Path reportDir;
    private final ObjectMapper mapper;

    public TelemetryReportWriter(Path reportDir) {
        this.reportDir = reportDir;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Exports the session and writes it to the report directory.
     *
     * @return path of the written report
     * @throws UncheckedIOException when the directory or file cannot be written
     */
    public Path write(BrowserTelemetrySession session) {
        return write(session.exportSummary());
    }

    public synchronized Path write(SessionExport export) {
        Path target = reportDir.resolve("telemetry-" + export.sessionId() + ".json");
        try {
            Files.createDirectories(reportDir);
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), export);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("TelemetryReportWriter: Failed to write report {}: {}", target, e.getMessage());
            throw new UncheckedIOException("Could not write telemetry report " + target, e);
        }
        log.info("TelemetryReportWriter: Report written to {}", target.toAbsolutePath());
        return target;
    }

    /** The export as a JSON string, for attaching to test reports. */
    public String toJson(SessionExport export) {
        try {
            return mapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session export is not serializable", e);
        }
    }

    public Path getReportDir() {
        return reportDir;
    }
}
