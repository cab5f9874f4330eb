package org.netpreserve.consolescan;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.consolescan.browser.BrowserPool;
import org.netpreserve.consolescan.browser.CdpBrowserLauncher;
import org.netpreserve.consolescan.config.ConfigLoader;
import org.netpreserve.consolescan.config.Cookie;
import org.netpreserve.consolescan.config.ScanConfig;
import org.netpreserve.consolescan.report.HtmlReport;
import org.netpreserve.consolescan.report.JsonReport;
import org.netpreserve.consolescan.report.ScanReport;
import org.netpreserve.consolescan.sitemap.SitemapException;
import org.netpreserve.consolescan.sitemap.SitemapSource;
import org.netpreserve.consolescan.util.Url;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

public class ConsoleScan {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(ConsoleScan.class);

    public static void main(String[] args) throws Exception {
        String start = null;
        Path configFile = null;
        boolean dumpConfig = false;
        var overrides = ConfigLoader.mapper().createObjectNode();
        var cookies = overrides.arrayNode();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--concurrency", "-c" -> section(overrides, "scan").put("concurrency", Integer.parseInt(args[++i]));
                case "--timeout", "-t" -> section(overrides, "scan").put("timeout", seconds(args[++i]));
                case "--filter", "-f" -> section(overrides, "scan").put("filter", args[++i]);
                case "--whitelist", "-w" -> section(overrides, "scan").put("whitelist", args[++i]);
                case "--console-level" -> section(overrides, "scan").put("consoleLevel", args[++i]);
                case "--user-agent" -> section(overrides, "scan").put("userAgent", args[++i]);
                case "--cookie" -> cookies.add(args[++i]);
                case "--no-consent" -> section(overrides, "consent").put("mode", "hide-only");
                case "--browser" -> section(overrides, "browser").put("executable", args[++i]);
                case "--no-headless" -> section(overrides, "browser").put("headless", false);
                case "--output-json" -> section(overrides, "report").put("json", args[++i]);
                case "--output-html" -> section(overrides, "report").put("html", args[++i]);
                case "--config" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--trace-cdp" -> startCdpTraceFile(args[++i]);
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    if (start != null) {
                        System.err.println("Only one sitemap may be given");
                        System.exit(1);
                    }
                    start = args[i];
                }
            }
        }
        if (!cookies.isEmpty()) section(overrides, "scan").set("cookies", cookies);

        ScanConfig config;
        try {
            config = ConfigLoader.load(configFile, overrides);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        if (dumpConfig) {
            System.out.print(ConfigLoader.toYaml(config));
            System.exit(0);
        }
        if (start == null) {
            printUsage();
            System.exit(1);
        }

        Whitelist whitelist = Whitelist.EMPTY;
        List<Url> urls;
        try {
            if (config.scan().whitelist() != null) whitelist = Whitelist.load(Path.of(config.scan().whitelist()));
            urls = new SitemapSource(config.scan().cookies(), config.scan().userAgent(), config.retry().backoff())
                    .discover(start);
        } catch (WhitelistException | SitemapException e) {
            log.error("{}", e.getMessage());
            System.exit(1);
            return;
        }

        var pool = new BrowserPool(new CdpBrowserLauncher(config.browser()), config.scan().concurrency());
        var probe = new HttpReachabilityProbe(config.retry().probeTimeout(), config.scan().userAgent());
        var scan = new ScanOrchestrator(config, pool, whitelist, probe);
        ScanHandle handle;
        try {
            handle = scan.start(urls, new LoggingScanListener(urls.size()));
        } catch (ScanException e) {
            log.error("{}", e.getMessage());
            pool.close();
            System.exit(1);
            return;
        }

        var reportsWritten = new AtomicBoolean();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (handle.isDone()) return;
            scan.cancel();
            ScanSummary summary;
            try {
                summary = handle.completion().get(config.scan().cancelGrace().toMillis() + 5000,
                        TimeUnit.MILLISECONDS);
            } catch (TimeoutException | InterruptedException | ExecutionException e) {
                log.warn("Scan didn't stop in time, writing partial reports");
                summary = ScanSummary.of(scan.currentResults(), urls.size(), scan.startedAt(),
                        Duration.between(scan.startedAt(), Instant.now()), config.report().topErrors(), true, null,
                        pool.restarts());
            }
            writeReports(config, ScanReport.of(summary, scan.currentResults()), reportsWritten);
            pool.close();
        }, "shutdown-hook"));

        ScanSummary summary = handle.awaitCompletion();
        writeReports(config, ScanReport.of(summary, scan.currentResults()), reportsWritten);
        pool.close();
        System.exit(summary.fault() == null ? 0 : 2);
    }

    private static void writeReports(ScanConfig config, ScanReport report, AtomicBoolean written) {
        if (!written.compareAndSet(false, true)) return;
        if (config.report().json() != null) {
            try {
                JsonReport.write(report, Path.of(config.report().json()));
                log.info("JSON report written to {}", Path.of(config.report().json()).toAbsolutePath());
            } catch (IOException e) {
                log.error("Unable to write JSON report", e);
            }
        }
        if (config.report().html() != null) {
            try {
                HtmlReport.write(report, Path.of(config.report().html()));
                log.info("HTML report written to {}", Path.of(config.report().html()).toAbsolutePath());
            } catch (IOException e) {
                log.error("Unable to write HTML report", e);
            }
        }
    }

    private static ObjectNode section(ObjectNode root, String name) {
        var node = root.get(name);
        if (node instanceof ObjectNode objectNode) return objectNode;
        return root.putObject(name);
    }

    /**
     * Bare numbers on the command line are seconds.
     */
    private static String seconds(String value) {
        return value.chars().allMatch(Character::isDigit) ? value + "s" : value;
    }

    private static void printUsage() {
        System.out.println("Usage: consolescan [options] SITEMAP_URL|SITEMAP_FILE|SITE_URL");
        System.out.println("Options:");
        System.out.println("  -c, --concurrency N         Pages to load at once (default 8)");
        System.out.println("  -t, --timeout SECONDS       Page load timeout (default 30)");
        System.out.println("  -f, --filter TEXT           Only scan URLs containing TEXT");
        System.out.println("  -w, --whitelist FILE        JSON file of message patterns to ignore");
        System.out.println("      --console-level LEVEL   error, warn (default) or all");
        System.out.println("      --user-agent UA         User-Agent to send");
        System.out.println("      --cookie NAME=VALUE     Cookie to set on every page (repeatable)");
        System.out.println("      --no-consent            Hide cookie banners instead of accepting them");
        System.out.println("      --browser EXECUTABLE    Chrome or Chromium binary to use");
        System.out.println("      --no-headless           Show the browser window");
        System.out.println("      --output-json FILE      Write a JSON report");
        System.out.println("      --output-html FILE      Write an HTML report");
        System.out.println("      --config FILE           YAML config file");
        System.out.println("      --dump-config           Print the effective config and exit");
        System.out.println("      --trace-cdp FILE        Write CDP trace to file");
        System.out.println("  -h, --help");
    }

    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] %-5level %logger{0} %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("cdp-trace-file");
        fileAppender.setFile(file);
        fileAppender.start();

        var logger = context.getLogger("org.netpreserve.consolescan.cdp.protocol");
        logger.addAppender(fileAppender);
        if (logger.getEffectiveLevel().toInt() != Level.TRACE_INT) {
            // keep the console at its usual level while the trace file gets everything
            var filter = new ThresholdFilter();
            filter.setLevel(logger.getEffectiveLevel().toString());
            filter.start();
            var stdoutAppender = (ConsoleAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .getAppender("STDOUT");
            if (stdoutAppender != null) {
                stdoutAppender.stop();
                stdoutAppender.addFilter(filter);
                stdoutAppender.start();
            }
            logger.setLevel(Level.TRACE);
        }
    }
}
