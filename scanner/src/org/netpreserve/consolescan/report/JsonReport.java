package org.netpreserve.consolescan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.netpreserve.consolescan.AttemptOutcome;
import org.netpreserve.consolescan.ErrorKind;
import org.netpreserve.consolescan.PageError;
import org.netpreserve.consolescan.PageStatus;
import org.netpreserve.consolescan.ScanResult;
import org.netpreserve.consolescan.ScanSummary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Machine-readable report: {@code generated_at}, {@code summary} and one entry per page under
 * {@code results}.
 */
public class JsonReport {
    static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.ALWAYS);

    public static void write(ScanReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        JSON.writeValue(file.toFile(), toDocument(report));
    }

    public static String toJson(ScanReport report) throws IOException {
        return JSON.writeValueAsString(toDocument(report));
    }

    static Document toDocument(ScanReport report) {
        return new Document(report.generatedAt(), summary(report.summary()),
                report.results().stream().map(JsonReport::result).toList());
    }

    private static Summary summary(ScanSummary summary) {
        var byStatus = new LinkedHashMap<String, Integer>();
        summary.byStatus().forEach((status, count) -> byStatus.put(status.id(), count));
        var byKind = new LinkedHashMap<String, Integer>();
        summary.byKind().forEach((kind, count) -> byKind.put(kind.id(), count));
        return new Summary(summary.startedAt(), summary.duration().toMillis(), summary.totalUrls(),
                summary.scanned(), summary.failed(), summary.skipped(), byStatus, byKind,
                summary.topErrors().stream()
                        .map(top -> new TopError(top.kind().id(), top.message(), top.pages(), top.occurrences()))
                        .toList(),
                summary.cancelled(),
                summary.fault() == null ? null : summary.fault().name().toLowerCase(Locale.ROOT),
                summary.browserRestarts());
    }

    private static Result result(ScanResult result) {
        var counts = new LinkedHashMap<String, Long>();
        for (ErrorKind kind : ErrorKind.values()) {
            long count = result.distinctCount(kind);
            if (count > 0) counts.put(kind.id(), count);
        }
        AttemptOutcome.Failed failure = result.failure();
        return new Result(result.url().toString(), result.status(), result.httpStatus(),
                result.loadTime() == null ? null : result.loadTime().toMillis(), result.attempts(),
                result.duration().toMillis(),
                failure == null ? null : new Failure(failure.kind().name().toLowerCase(Locale.ROOT), failure.message()),
                counts, result.errors().stream().map(JsonReport::error).toList(), result.finishedAt());
    }

    private static ErrorEntry error(PageError error) {
        return new ErrorEntry(error.kind(), error.severity().name().toLowerCase(Locale.ROOT), error.message(),
                error.sourceUrl(), error.line(), error.occurrences(), error.whitelisted(), error.timestamp());
    }

    record Document(Instant generatedAt, Summary summary, List<Result> results) {
    }

    record Summary(Instant startedAt, long durationMs, int totalUrls, int scanned, int failed, int skipped,
                   Map<String, Integer> byStatus, Map<String, Integer> byKind, List<TopError> topErrors,
                   boolean cancelled, String fault, int browserRestarts) {
    }

    record TopError(String kind, String message, int pages, int occurrences) {
    }

    record Result(String url, PageStatus status, Integer httpStatus, Long loadTimeMs, int attempts, long durationMs,
                  Failure failure, Map<String, Long> counts, List<ErrorEntry> errors, Instant finishedAt) {
    }

    record Failure(String kind, String message) {
    }

    record ErrorEntry(ErrorKind kind, String severity, String message, String source, Integer line, int occurrences,
                      boolean whitelisted, Instant timestamp) {
    }
}
