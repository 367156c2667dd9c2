package com.webtelemetry.core;

import com.webtelemetry.model.ConsoleEventData;
import com.webtelemetry.model.RequestEventData;
import com.webtelemetry.model.ResponseEventData;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for converting loosely-typed payload maps into event records.
 */
public class TelemetryPayloadsTest {

    @Test
    public void snakeCaseKeys_areAccepted() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("request_id", "r1");
        raw.put("url", "https://a.com/x");
        raw.put("method", "POST");
        raw.put("resource_type", "fetch");
        raw.put("post_data", "{}");
        raw.put("headers", Map.of("content_type", "application/json"));
        raw.put("frame_id", "ignored");

        RequestEventData data = TelemetryPayloads.convert(raw, RequestEventData.class);

        assertThat(data.requestId()).isEqualTo("r1");
        assertThat(data.resourceType()).isEqualTo("fetch");
        assertThat(data.postData()).isEqualTo("{}");
        assertThat(data.headers()).as("header names are left untouched").containsKey("content_type");
    }

    @Test
    public void nestedTimingAndLocation_areNormalised() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", 200);
        response.put("from_cache", true);
        response.put("compressed_size", 120);
        response.put("timing", Map.of("dns_lookup", 4.5, "total_time", 80));

        ResponseEventData data = TelemetryPayloads.convert(response, ResponseEventData.class);
        assertThat(data.status()).isEqualTo(200);
        assertThat(data.isCacheHit()).isTrue();
        assertThat(data.compressedSize()).isEqualTo(120L);
        assertThat(data.timing().dnsLookup()).isEqualTo(4.5);
        assertThat(data.timing().totalTime()).isEqualTo(80.0);

        Map<String, Object> console = new HashMap<>();
        console.put("text", "hi");
        console.put("type", "log");
        console.put("level", "warn");
        console.put("location", Map.of("url", "app.js", "line_number", 3, "column_number", 9));

        ConsoleEventData event = TelemetryPayloads.convert(console, ConsoleEventData.class);
        assertThat(event.level()).isEqualTo("warn");
        assertThat(event.location().lineNumber()).isEqualTo(3);
        assertThat(event.location().columnNumber()).isEqualTo(9);
    }

    @Test
    public void toCamelCase_handlesEdgeCases() {
        assertThat(TelemetryPayloads.toCamelCase("already")).isEqualTo("already");
        assertThat(TelemetryPayloads.toCamelCase("request_id")).isEqualTo("requestId");
        assertThat(TelemetryPayloads.toCamelCase("_private")).isEqualTo("private");
        assertThat(TelemetryPayloads.toCamelCase("from_disk_cache")).isEqualTo("fromDiskCache");
    }

    @Test
    public void nullPayload_convertsToEmptyRecord() {
        ConsoleEventData data = TelemetryPayloads.convert(null, ConsoleEventData.class);

        assertThat(data.text()).isNull();
        assertThat(data.timestamp()).isNull();
    }

    @Test
    public void unbindableValues_areDroppedAndTheRestConverts() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "200 OK");
        response.put("size", 2048);
        response.put("timing", "fast");
        List<String> dropped = new ArrayList<>();

        ResponseEventData data = TelemetryPayloads.convert(response, ResponseEventData.class, dropped::add);

        assertThat(data.status()).isNull();
        assertThat(data.timing()).isNull();
        assertThat(data.size()).isEqualTo(2048L);
        assertThat(dropped).containsExactlyInAnyOrder("status", "timing");
    }
}
