package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.consolescan.util.ShellCommandDeserializer;

import java.util.List;

/**
 * Configuration for the browser.
 *
 * @param executable binary to invoke (e.g. "google-chrome-stable"), or null to search for one
 * @param options    extra command-line options
 * @param shell      shell used to launch the browser (e.g. ["ssh", "user@host"])
 * @param headless   run without a visible window
 */
public record BrowserConfig(
        String executable,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        List<String> options,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        List<String> shell,
        boolean headless
) {
}
