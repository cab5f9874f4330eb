package org.netpreserve.consolescan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportTest {
    @TempDir
    Path tempDir;

    @Test
    void writesSummaryAndResultsInSnakeCase() throws Exception {
        Path file = tempDir.resolve("out/report.json");
        JsonReport.write(ReportFixtures.report(), file);

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals("2024-05-01T10:15:30Z", root.path("generated_at").asText());

        JsonNode summary = root.path("summary");
        assertEquals(3, summary.path("total_urls").asInt());
        assertEquals(1, summary.path("scanned").asInt());
        assertEquals(1, summary.path("failed").asInt());
        assertEquals(1, summary.path("skipped").asInt());
        assertEquals(1, summary.path("by_status").path("error").asInt());
        assertEquals(1, summary.path("by_kind").path("console_error").asInt());
        assertEquals(0, summary.path("by_kind").path("console_warn").asInt(), "whitelisted messages not counted");
        assertTrue(summary.path("cancelled").asBoolean());
        assertTrue(summary.path("fault").isNull());
        assertEquals(2, summary.path("top_errors").get(0).path("occurrences").asInt());

        JsonNode first = root.path("results").get(0);
        assertEquals("https://example.org/", first.path("url").asText());
        assertEquals("error", first.path("status").asText());
        assertEquals(200, first.path("http_status").asInt());
        assertEquals(900, first.path("load_time_ms").asLong());
        assertEquals(1, first.path("counts").path("console_error").asInt());
        JsonNode error = first.path("errors").get(0);
        assertEquals("console_error", error.path("kind").asText());
        assertEquals("error", error.path("severity").asText());
        assertEquals("https://example.org/app.js", error.path("source").asText());
        assertEquals(4, error.path("line").asInt());
        assertEquals(2, error.path("occurrences").asInt());
        assertTrue(first.path("errors").get(1).path("whitelisted").asBoolean());

        JsonNode failed = root.path("results").get(1);
        assertEquals("failed", failed.path("status").asText());
        assertEquals("timeout", failed.path("failure").path("kind").asText());
        assertEquals(3, failed.path("attempts").asInt());
        assertTrue(failed.path("http_status").isNull());
    }
}
