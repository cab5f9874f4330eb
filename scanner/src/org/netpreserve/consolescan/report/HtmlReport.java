package org.netpreserve.consolescan.report;

import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.consolescan.ErrorKind;
import org.netpreserve.consolescan.PageError;
import org.netpreserve.consolescan.PageStatus;
import org.netpreserve.consolescan.ScanResult;
import org.netpreserve.consolescan.ScanSummary;
import org.netpreserve.consolescan.Severity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Self-contained HTML page: summary cards, the most common messages and a row per page with its diagnostics
 * listed underneath.
 */
public class HtmlReport {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());
    private static final String CSS = """
            * { box-sizing: border-box; margin: 0; padding: 0; }
            body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; background: #0d1117; color: #c9d1d9; padding: 20px; }
            h1 { color: #58a6ff; margin-bottom: 10px; font-size: 1.5rem; }
            h2 { color: #c9d1d9; margin: 25px 0 10px; font-size: 1.1rem; }
            .timestamp { color: #8b949e; margin-bottom: 20px; }
            .summary { display: flex; gap: 15px; flex-wrap: wrap; margin-bottom: 25px; }
            .summary-card { background: #161b22; border: 1px solid #30363d; border-radius: 6px; padding: 15px 20px; min-width: 140px; }
            .summary-card .label { color: #8b949e; font-size: 0.8rem; text-transform: uppercase; }
            .summary-card .value { font-size: 1.8rem; font-weight: bold; margin-top: 5px; }
            .value.ok { color: #3fb950; } .value.warn { color: #d29922; } .value.error, .value.failed { color: #f85149; }
            table { width: 100%; border-collapse: collapse; background: #161b22; border-radius: 6px; overflow: hidden; }
            th { background: #21262d; color: #8b949e; text-align: left; padding: 10px 12px; font-size: 0.8rem; text-transform: uppercase; }
            td { padding: 8px 12px; border-top: 1px solid #21262d; font-size: 0.9rem; }
            tr.error td, tr.failed td { color: #f85149; } tr.warn td { color: #d29922; } tr.ignored td { color: #8b949e; }
            tr.detail-row td { background: #1c2128; padding: 5px 12px 10px 40px; color: #c9d1d9; }
            .error-list { list-style: none; }
            .error-list li { padding: 3px 0; font-family: monospace; font-size: 0.85rem; word-break: break-all; }
            .error-list li.whitelisted { opacity: 0.5; }
            .kind { display: inline-block; padding: 1px 6px; border-radius: 3px; font-size: 0.75rem; margin-right: 6px; background: #30363d; }
            .severity-error { background: #f8514933; color: #f85149; }
            .severity-warning { background: #d2992233; color: #d29922; }
            .source { color: #8b949e; }
            a { color: #58a6ff; text-decoration: none; }
            a:hover { text-decoration: underline; }
            """;

    public static void write(ScanReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, render(report), StandardCharsets.UTF_8);
    }

    public static String render(ScanReport report) {
        Document document = Document.createShell("");
        document.outputSettings().charset(StandardCharsets.UTF_8).prettyPrint(true);
        var html = document.selectFirst("html");
        if (html != null) html.attr("lang", "en");
        var head = document.head();
        head.appendElement("meta").attr("charset", "utf-8");
        head.appendElement("meta").attr("name", "viewport").attr("content", "width=device-width, initial-scale=1");
        String generated = TIMESTAMP.format(report.generatedAt());
        document.title("Console error scan - " + generated);
        head.appendElement("style").appendChild(new DataNode(CSS));

        var body = document.body();
        body.appendElement("h1").text("Console error scan");
        var timestamp = body.appendElement("p").addClass("timestamp").text("Generated " + generated);
        ScanSummary summary = report.summary();
        if (summary.cancelled()) timestamp.appendText(" (cancelled, partial results)");
        if (summary.fault() != null) timestamp.appendText(" (stopped: " + summary.fault() + ")");

        renderSummary(body, summary);
        renderTopErrors(body, summary);
        renderResults(body, report);
        return document.outerHtml();
    }

    private static void renderSummary(Element body, ScanSummary summary) {
        var cards = body.appendElement("div").addClass("summary");
        card(cards, "URLs", summary.totalUrls(), "");
        card(cards, "Scanned", summary.scanned(), "");
        card(cards, "OK", summary.count(PageStatus.OK), "ok");
        card(cards, "Warnings", summary.count(PageStatus.WARN), summary.count(PageStatus.WARN) > 0 ? "warn" : "ok");
        card(cards, "Errors", summary.count(PageStatus.ERROR), summary.count(PageStatus.ERROR) > 0 ? "error" : "ok");
        card(cards, "Ignored", summary.count(PageStatus.IGNORED), "");
        card(cards, "Failed", summary.failed(), summary.failed() > 0 ? "failed" : "ok");
        card(cards, "Console errors", summary.distinctCount(ErrorKind.CONSOLE_ERROR), "");
        card(cards, "HTTP errors", summary.distinctCount(ErrorKind.HTTP_ERROR), "");
        var duration = cards.appendElement("div").addClass("summary-card");
        duration.appendElement("div").addClass("label").text("Duration");
        duration.appendElement("div").addClass("value").text(String.format(Locale.ROOT, "%.1fs",
                summary.duration().toMillis() / 1000.0));
    }

    private static void card(Element cards, String label, int value, String valueClass) {
        var card = cards.appendElement("div").addClass("summary-card");
        card.appendElement("div").addClass("label").text(label);
        var valueElement = card.appendElement("div").addClass("value").text(Integer.toString(value));
        if (!valueClass.isEmpty()) valueElement.addClass(valueClass);
    }

    private static void renderTopErrors(Element body, ScanSummary summary) {
        if (summary.topErrors().isEmpty()) return;
        body.appendElement("h2").text("Most common messages");
        var table = body.appendElement("table").addClass("top-errors");
        var header = table.appendElement("thead").appendElement("tr");
        for (String title : new String[]{"Kind", "Message", "Pages", "Occurrences"}) {
            header.appendElement("th").text(title);
        }
        var rows = table.appendElement("tbody");
        for (ScanSummary.TopError top : summary.topErrors()) {
            var row = rows.appendElement("tr");
            row.appendElement("td").appendElement("span").addClass("kind")
                    .addClass("severity-" + top.kind().severity().name().toLowerCase(Locale.ROOT))
                    .text(top.kind().id());
            row.appendElement("td").text(top.message());
            row.appendElement("td").text(Integer.toString(top.pages()));
            row.appendElement("td").text(Integer.toString(top.occurrences()));
        }
    }

    private static void renderResults(Element body, ScanReport report) {
        body.appendElement("h2").text("Pages");
        var table = body.appendElement("table").addClass("results");
        var header = table.appendElement("thead").appendElement("tr");
        for (String title : new String[]{"#", "Status", "URL", "HTTP", "Load time", "Attempts", "Errors",
                "Warnings"}) {
            header.appendElement("th").text(title);
        }
        var rows = table.appendElement("tbody");
        int index = 0;
        for (ScanResult result : report.results()) {
            index++;
            var row = rows.appendElement("tr").addClass(result.status().id());
            row.appendElement("td").text(Integer.toString(index));
            row.appendElement("td").addClass("status-cell").text(result.status().id());
            row.appendElement("td").appendElement("a")
                    .attr("href", result.url().toString())
                    .attr("target", "_blank")
                    .attr("rel", "noopener")
                    .text(result.url().toString());
            row.appendElement("td").text(result.httpStatus() == null ? "-" : result.httpStatus().toString());
            row.appendElement("td").text(result.loadTime() == null ? "-" : result.loadTime().toMillis() + "ms");
            row.appendElement("td").text(Integer.toString(result.attempts()));
            row.appendElement("td").text(Long.toString(result.distinctCount(Severity.ERROR)));
            row.appendElement("td").text(Long.toString(result.distinctCount(Severity.WARNING)));

            if (result.failure() == null && result.errors().isEmpty()) continue;
            var list = rows.appendElement("tr").addClass("detail-row")
                    .appendElement("td").attr("colspan", "8")
                    .appendElement("ul").addClass("error-list");
            if (result.failure() != null) {
                var item = list.appendElement("li");
                item.appendElement("span").addClass("kind").addClass("severity-error")
                        .text(result.failure().kind().name().toLowerCase(Locale.ROOT));
                item.appendText(result.failure().message());
            }
            for (PageError error : result.errors()) {
                var item = list.appendElement("li");
                if (error.whitelisted()) item.addClass("whitelisted");
                item.appendElement("span").addClass("kind")
                        .addClass("severity-" + error.severity().name().toLowerCase(Locale.ROOT))
                        .text(error.kind().id());
                item.appendText(error.message());
                if (error.occurrences() > 1) item.appendText(" (x" + error.occurrences() + ")");
                if (error.source() != null) {
                    item.appendText(" ");
                    item.appendElement("span").addClass("source").text("(" + error.source() + ")");
                }
            }
        }
    }
}
