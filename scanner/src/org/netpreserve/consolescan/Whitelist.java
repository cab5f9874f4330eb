package org.netpreserve.consolescan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.consolescan.util.Glob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Known-harmless messages. A diagnostic whose whole message matches any pattern is still recorded but
 * marked whitelisted, and doesn't count against the page's status.
 * <p>
 * File format: {@code {"description": "...", "patterns": ["*AppInsights*", "ResizeObserver loop*"]}}
 */
public class Whitelist {
    private static final Logger log = LoggerFactory.getLogger(Whitelist.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    public static final Whitelist EMPTY = new Whitelist("", List.of());

    private final String description;
    private final List<Glob> patterns;

    public Whitelist(String description, List<Glob> patterns) {
        this.description = description == null ? "" : description;
        this.patterns = List.copyOf(patterns);
    }

    public static Whitelist of(String... patterns) {
        var globs = new ArrayList<Glob>();
        for (String pattern : patterns) globs.add(Glob.compile(pattern));
        return new Whitelist("", globs);
    }

    public static Whitelist load(Path file) throws WhitelistException {
        JsonNode root;
        try {
            root = JSON.readTree(Files.readString(file));
        } catch (IOException e) {
            throw new WhitelistException("Unable to read whitelist " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new WhitelistException("Whitelist " + file + " must be a JSON object with a patterns array");
        }
        JsonNode patternsNode = root.path("patterns");
        if (!patternsNode.isArray()) {
            throw new WhitelistException("Whitelist " + file + " has no patterns array");
        }
        var patterns = new ArrayList<Glob>();
        for (JsonNode node : patternsNode) {
            if (!node.isTextual() || node.asText().isBlank()) {
                log.warn("Skipping whitelist pattern {} in {}: not a non-empty string", node, file);
                continue;
            }
            patterns.add(Glob.compile(node.asText()));
        }
        log.info("Loaded {} whitelist patterns from {}", patterns.size(), file);
        return new Whitelist(root.path("description").asText(""), patterns);
    }

    public boolean matches(String message) {
        for (Glob pattern : patterns) {
            if (pattern.matches(message)) return true;
        }
        return false;
    }

    public String description() {
        return description;
    }

    public List<Glob> patterns() {
        return patterns;
    }

    public int size() {
        return patterns.size();
    }
}
