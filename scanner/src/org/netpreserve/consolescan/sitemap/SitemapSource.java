package org.netpreserve.consolescan.sitemap;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.netpreserve.consolescan.RetryPolicy;
import org.netpreserve.consolescan.config.Cookie;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

/**
 * Produces the list of pages to scan from a sitemap URL, a local sitemap file or just a site's address.
 * <p>
 * For a bare site address the sitemap is looked for in robots.txt and then at a few common paths. Sitemap
 * indexes are followed a few levels deep.
 */
public class SitemapSource {
    private static final Logger log = LoggerFactory.getLogger(SitemapSource.class);
    static final List<String> COMMON_SITEMAP_PATHS = List.of(
            "/sitemap.xml",
            "/sitemap_index.xml",
            "/sitemap/sitemap.xml",
            "/sitemapindex.xml",
            "/sitemap/index.xml");
    static final int MAX_DEPTH = 3;
    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);
    private final HttpClient httpClient;
    private final List<Cookie> cookies;
    private final String userAgent;
    private final RetryPolicy retryPolicy;

    public SitemapSource(List<Cookie> cookies, @Nullable String userAgent, Duration backoff) {
        this.cookies = List.copyOf(cookies);
        this.userAgent = userAgent;
        this.retryPolicy = new RetryPolicy(3, backoff);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * @param start sitemap URL, path to a local sitemap file, or a site URL to search for a sitemap on
     * @return page URLs in sitemap order without duplicates
     */
    public List<Url> discover(String start) throws SitemapException, InterruptedException {
        start = start.trim();
        var seeds = new ArrayList<Url>();
        var pages = new LinkedHashSet<Url>();
        if (isLocalFile(start)) {
            Path file = Path.of(start);
            log.info("Reading sitemap file {}", file);
            String xml;
            try {
                xml = decode(Files.readAllBytes(file), file.toString());
            } catch (IOException e) {
                throw new SitemapException("Unable to read " + file + ": " + e.getMessage(), e);
            }
            parse(xml, seeds, pages);
            crawl(seeds, 1, pages);
        } else {
            Url url = new Url(start.contains("://") ? start : "https://" + start);
            if (!url.isHttp()) throw new SitemapException("Not a sitemap URL or file: " + start);
            seeds.add(isSitemapUrl(url) ? url : findSitemap(url));
            crawl(seeds, 0, pages);
        }
        if (pages.isEmpty()) throw new SitemapException("No page URLs found in sitemap " + start);
        log.info("Found {} URLs in sitemap {}", pages.size(), start);
        return new ArrayList<>(pages);
    }

    private void crawl(List<Url> seeds, int depth, LinkedHashSet<Url> pages) throws SitemapException,
            InterruptedException {
        var queue = new ArrayDeque<SitemapTask>();
        for (Url seed : seeds) queue.addLast(new SitemapTask(seed, depth));
        var visited = new LinkedHashSet<Url>();
        SitemapException firstFailure = null;
        while (!queue.isEmpty()) {
            SitemapTask task = queue.removeFirst();
            if (task.depth() > MAX_DEPTH || !visited.add(task.url())) continue;
            String xml;
            try {
                xml = fetchWithRetries(task.url());
            } catch (SitemapException e) {
                if (firstFailure == null) firstFailure = e;
                log.warn("{}", e.getMessage());
                continue;
            }
            var children = new ArrayList<Url>();
            parse(xml, children, pages);
            for (Url child : children) queue.addLast(new SitemapTask(child, task.depth() + 1));
        }
        if (pages.isEmpty() && firstFailure != null) throw firstFailure;
    }

    /**
     * Collects child sitemaps from an index and page URLs from a urlset.
     */
    static void parse(String xml, List<Url> childSitemaps, LinkedHashSet<Url> pages) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        for (Element loc : document.select("sitemap > loc")) {
            String text = loc.text().trim();
            if (!text.isEmpty()) childSitemaps.add(new Url(sanitize(text)));
        }
        for (Element urlElement : document.select("url")) {
            Element loc = urlElement.selectFirst("loc");
            if (loc == null) continue;
            String text = loc.text().trim();
            if (!text.isEmpty()) pages.add(new Url(sanitize(text)));
        }
    }

    /**
     * Percent-encodes parentheses, which some sitemaps leave raw and browsers treat inconsistently.
     */
    static String sanitize(String url) {
        return url.replace("(", "%28").replace(")", "%29");
    }

    static boolean isSitemapUrl(Url url) {
        try {
            String path = url.toURI().getPath();
            if (path == null) return false;
            path = path.toLowerCase(Locale.ROOT);
            return path.endsWith(".xml") || path.endsWith(".xml.gz");
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isLocalFile(String start) {
        String lower = start.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return false;
        try {
            return Files.isRegularFile(Path.of(start));
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Looks for a sitemap via robots.txt and then at common locations.
     */
    Url findSitemap(Url site) throws SitemapException, InterruptedException {
        Url origin = site.origin();
        Url robotsTxt = origin.resolve("/robots.txt");
        log.info("Looking for sitemap in {}", robotsTxt);
        try {
            var response = fetch(robotsTxt);
            if (response.statusCode() == 200) {
                for (String candidate : sitemapsFromRobotsTxt(decode(response.body(), robotsTxt.toString()))) {
                    Url url = origin.resolve(candidate);
                    if (isValidSitemap(url)) return url;
                    log.info("Sitemap {} listed in robots.txt is not usable", url);
                }
            }
        } catch (IOException e) {
            log.info("Unable to fetch {}: {}", robotsTxt, e.getMessage());
        }
        for (String path : COMMON_SITEMAP_PATHS) {
            Url candidate = origin.resolve(path);
            log.debug("Trying {}", candidate);
            if (isValidSitemap(candidate)) return candidate;
        }
        throw new SitemapException("No sitemap found for " + site + " (tried robots.txt and "
                                   + String.join(", ", COMMON_SITEMAP_PATHS) + "). Pass the sitemap URL directly.");
    }

    static List<String> sitemapsFromRobotsTxt(String robotsTxt) {
        return robotsTxt.lines()
                .map(String::trim)
                .filter(line -> line.toLowerCase(Locale.ROOT).startsWith("sitemap:"))
                .map(line -> line.substring("sitemap:".length()).trim())
                .filter(url -> !url.isEmpty())
                .collect(Collectors.toList());
    }

    private boolean isValidSitemap(Url url) throws InterruptedException {
        try {
            var response = fetch(url);
            if (response.statusCode() != 200) return false;
            String body = decode(response.body(), url.toString());
            return body.contains("<urlset") || body.contains("<sitemapindex");
        } catch (IOException e) {
            log.debug("Unable to fetch {}: {}", url, e.getMessage());
            return false;
        }
    }

    private String fetchWithRetries(Url url) throws SitemapException, InterruptedException {
        String lastError = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                var response = fetch(url);
                int status = response.statusCode();
                if (status == 200) return decode(response.body(), url.toString());
                lastError = "HTTP " + status;
                if (status < 500) break;
            } catch (IOException e) {
                lastError = e.toString();
            }
            if (attempt < retryPolicy.maxAttempts()) {
                Duration delay = retryPolicy.backoffAfter(attempt);
                log.info("Fetching sitemap {} failed ({}), retrying in {}s", url, lastError, delay.toSeconds());
                Thread.sleep(delay.toMillis());
            }
        }
        throw new SitemapException("Unable to fetch sitemap " + url + ": " + lastError);
    }

    private HttpResponse<byte[]> fetch(Url url) throws IOException, InterruptedException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new IOException("Malformed URL " + url, e);
        }
        var builder = HttpRequest.newBuilder(uri)
                .timeout(FETCH_TIMEOUT)
                .header("Accept", "application/xml,text/xml;q=0.9,*/*;q=0.1");
        if (userAgent != null) builder.header("User-Agent", userAgent);
        if (!cookies.isEmpty()) {
            builder.header("Cookie", cookies.stream().map(Cookie::toString).collect(Collectors.joining("; ")));
        }
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unable to fetch " + url, e);
        }
    }

    static String decode(byte[] body, String name) throws IOException {
        boolean gzip = name.toLowerCase(Locale.ROOT).endsWith(".gz")
                       || (body.length >= 2 && (body[0] & 0xFF) == 0x1f && (body[1] & 0xFF) == 0x8b);
        if (gzip) {
            try (var stream = new GZIPInputStream(new ByteArrayInputStream(body))) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    private record SitemapTask(Url url, int depth) {
    }
}
