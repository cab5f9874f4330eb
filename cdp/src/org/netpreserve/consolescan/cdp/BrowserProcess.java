package org.netpreserve.consolescan.cdp;

import org.netpreserve.consolescan.cdp.domains.Browser;
import org.netpreserve.consolescan.cdp.domains.Target;
import org.netpreserve.consolescan.cdp.protocol.CDPClient;
import org.netpreserve.consolescan.cdp.protocol.CDPException;
import org.netpreserve.consolescan.cdp.protocol.CDPSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.lang.ProcessBuilder.Redirect.INHERIT;
import static java.lang.ProcessBuilder.Redirect.PIPE;
import static java.util.stream.Collectors.joining;

/**
 * A Chromium process we launched and control over CDP.
 *
 * <pre>{@code
 * try (var browser = BrowserProcess.start(null, List.of(), true, null);
 *      var navigator = browser.newTab(event -> System.out.println(event))) {
 *     navigator.navigate(new Url("https://example.org/")).loaded().get();
 * }
 * }</pre>
 */
public class BrowserProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium",
            "chromium-browser",
            "google-chrome",
            "google-chrome-stable",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "/Applications/Chromium.app/Contents/MacOS/Chromium",
            "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe");
    private static final int WINDOW_WIDTH = 1920;
    private static final int WINDOW_HEIGHT = 1080;

    private final Process process;
    private final CDPClient cdp;
    private final Browser browser;
    private final Target target;
    private final Path profileToDelete;
    private Browser.Version version;

    private BrowserProcess(Process process, CDPClient cdp, Path profileToDelete) {
        this.process = process;
        this.cdp = cdp;
        this.browser = cdp.domain(Browser.class);
        this.target = cdp.domain(Target.class);
        this.profileToDelete = profileToDelete;
    }

    /**
     * Launches a browser with a throwaway profile.
     *
     * @param executable browser to run, or null to look for a common Chrome or Chromium install
     * @param options    extra command-line switches
     * @param headless   whether to run without a visible window
     * @param shell      shell command prefix (e.g. {@code [ssh, host]}) to launch through, or null for /bin/sh
     *                   when available
     */
    public static BrowserProcess start(String executable, List<String> options, boolean headless,
                                       List<String> shell) throws IOException {
        if (shell == null && Files.exists(Path.of("/bin/sh"))) {
            shell = List.of("/bin/sh", "-c");
        }
        if (executable == null) {
            executable = probeForExecutable(shell);
        }
        Path profileDir = shell != null
                ? Path.of("/tmp", "consolescan-" + Long.toHexString(System.nanoTime()) + "-" + ProcessHandle.current().pid())
                : Files.createTempDirectory("consolescan-");

        var command = new ArrayList<>(List.of(executable,
                shell != null ? "--remote-debugging-pipe" : "--remote-debugging-port=0",
                "--user-data-dir=" + profileDir,
                "--no-default-browser-check",
                "--no-first-run",
                "--disable-search-engine-choice-screen",
                "--disable-background-networking",
                "--disable-background-timer-throttling",
                "--disable-backgrounding-occluded-windows",
                "--disable-renderer-backgrounding",
                "--disable-sync",
                "--disable-blink-features=AutomationControlled",
                "--use-mock-keychain",
                "--window-size=" + WINDOW_WIDTH + "," + WINDOW_HEIGHT));
        if (headless) command.add("--headless=new");
        if (options != null) command.addAll(options);

        Process process;
        if (shell != null) {
            // Chromium's pipe mode reads commands from fd 3 and writes replies to fd 4. Java can't hand a child
            // arbitrary descriptors, so the shell rewires our stdin/stdout onto them. The shell also cleans up the
            // profile, which may be on a remote machine.
            String browserCommand = command.stream().map(BrowserProcess::singleQuote).collect(joining(" "));
            String cleanup = "rm -rf " + singleQuote(profileDir.toString()) + " 2>/dev/null";
            var shellCommand = new ArrayList<>(shell);
            shellCommand.add("trap " + singleQuote(cleanup) + " EXIT && mkdir -p " + singleQuote(profileDir.toString())
                             + " && " + browserCommand + " 3<&0 4>&1 0<&- 1>&2");
            process = new ProcessBuilder(shellCommand)
                    .redirectError(INHERIT)
                    .redirectOutput(PIPE)
                    .redirectInput(PIPE)
                    .start();
        } else {
            process = new ProcessBuilder(command)
                    .redirectOutput(INHERIT)
                    .redirectError(PIPE)
                    .start();
        }
        log.debug("Started browser pid {}: {}", process.pid(), command);
        java.lang.Runtime.getRuntime().addShutdownHook(new Thread(() -> terminate(process), "BrowserProcess-shutdown"));

        try {
            CDPClient cdp = shell != null
                    ? new CDPClient(process.getInputStream(), process.getOutputStream())
                    : new CDPClient(readDevtoolsUrl(process));
            return new BrowserProcess(process, cdp, shell != null ? null : profileDir);
        } catch (IOException | RuntimeException e) {
            terminate(process);
            throw e;
        }
    }

    private static void terminate(Process process) {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) return;
            process.destroy();
            if (process.waitFor(10, TimeUnit.SECONDS)) return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        process.destroyForcibly();
    }

    private static String singleQuote(String string) {
        return "'" + string.replace("'", "'\\''") + "'";
    }

    private static String probeForExecutable(List<String> shell) throws IOException {
        if (shell == null) {
            for (var executable : BROWSER_EXECUTABLES) {
                if (Files.isExecutable(Path.of(executable))) return executable;
                for (String dir : System.getenv().getOrDefault("PATH", "").split(java.io.File.pathSeparator)) {
                    if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, executable))) return executable;
                }
            }
            throw new IOException("No Chrome or Chromium found. Set browser.executable or use --browser");
        }
        String probe = BROWSER_EXECUTABLES.stream()
                .map(executable -> "command -v " + singleQuote(executable))
                .collect(joining(" || "));
        var shellCommand = new ArrayList<>(shell);
        shellCommand.add(probe);
        var process = new ProcessBuilder(shellCommand)
                .redirectError(INHERIT)
                .redirectOutput(PIPE)
                .start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
        try {
            if (process.waitFor() != 0 || output.isEmpty()) {
                throw new IOException("No Chrome or Chromium found (shell: " + shell + "). " +
                                      "Set browser.executable or use --browser");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted looking for a browser", e);
        }
        return output.lines().findFirst().orElse(output);
    }

    private static URI readDevtoolsUrl(Process process) throws IOException {
        var future = new CompletableFuture<URI>();
        var thread = new Thread(() -> {
            var prefix = "DevTools listening on ";
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                reader.lines().forEach(line -> {
                    if (line.startsWith(prefix)) {
                        future.complete(URI.create(line.substring(prefix.length()).trim()));
                    } else {
                        log.debug("Browser: {}", line);
                    }
                });
                future.completeExceptionally(new IOException("Browser exited before opening a devtools port"));
            } catch (IOException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, "Browser-stderr");
        thread.setDaemon(true);
        thread.start();
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Unable to read devtools URL", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Browser didn't report a devtools URL within 10s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for devtools URL", e);
        }
    }

    /**
     * Opens a blank tab in its own browser context. Diagnostics observed in the tab are passed to the event
     * handler, which is called on the connection thread and so must not block.
     */
    public Navigator newTab(Consumer<PageEvent> eventHandler) {
        String browserContextId = target.createBrowserContext(true);
        try {
            String targetId = target.createTarget("about:blank", browserContextId, WINDOW_WIDTH, WINDOW_HEIGHT);
            String sessionId = target.attachToTarget(targetId, true);
            return new Navigator(new CDPSession(cdp, sessionId, targetId), browserContextId, eventHandler);
        } catch (CDPException e) {
            disposeContext(cdp, browserContextId);
            throw e;
        }
    }

    static void disposeContext(CDPClient cdp, String browserContextId) {
        if (!cdp.isConnected()) return;
        try {
            cdp.domain(Target.class).disposeBrowserContext(browserContextId);
        } catch (CDPException e) {
            log.debug("Error disposing browser context {}: {}", browserContextId, e.getMessage());
        }
    }

    public boolean isConnected() {
        return cdp.isConnected() && process.isAlive();
    }

    public Browser.Version version() {
        if (version == null) {
            version = browser.getVersion();
        }
        return version;
    }

    /**
     * Asks the browser to quit, then kills it if it doesn't.
     */
    @Override
    public void close() {
        if (cdp.isConnected()) {
            try {
                browser.close();
            } catch (CDPException e) {
                log.debug("Browser.close failed: {}", e.getMessage());
            }
        }
        cdp.close();
        process.destroy();
        try {
            if (!process.waitFor(10, TimeUnit.SECONDS)) process.destroyForcibly();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        if (profileToDelete != null) deleteRecursively(profileToDelete);
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.warn("Unable to delete browser profile {}", dir, e);
        }
    }
}
