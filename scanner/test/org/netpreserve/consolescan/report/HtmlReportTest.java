package org.netpreserve.consolescan.report;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HtmlReportTest {
    @TempDir
    Path tempDir;

    @Test
    void escapesPageContent() {
        String html = HtmlReport.render(ReportFixtures.report());

        assertFalse(html.contains("<script>alert"), "message must be escaped");
        assertTrue(html.contains("&lt;script&gt;alert('x')&lt;/script&gt; is not defined"));
    }

    @Test
    void listsEveryPageWithItsDiagnostics() throws Exception {
        Path file = tempDir.resolve("report.html");
        HtmlReport.write(ReportFixtures.report(), file);
        Document document = Jsoup.parse(Files.readString(file));

        assertEquals(2, document.select("table.results > tbody > tr:not(.detail-row)").size());
        assertEquals("https://example.org/", document.select("table.results a").first().attr("href"));
        assertEquals(1, document.select("li.whitelisted").size());
        assertTrue(document.select(".error-list").text().contains("Not loaded within 30s"));
        assertTrue(document.select(".source").text().contains("https://example.org/app.js:4"));
        assertEquals(1, document.select("table.top-errors > tbody > tr").size());
        assertTrue(document.select("p.timestamp").text().contains("cancelled"));
    }
}
