package org.netpreserve.consolescan.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Builds the effective {@link ScanConfig} by layering the built-in defaults, an optional config file and
 * overrides from the command line.
 */
public class ConfigLoader {
    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static ScanConfig defaults() {
        try {
            return load(null, null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Defaults merged with a YAML snippet, e.g. {@code "scan: {concurrency: 2}"}.
     */
    public static ScanConfig withOverrides(String yaml) {
        try {
            return load(null, (ObjectNode) mapper.readTree(yaml));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ScanConfig load(@Nullable Path configFile, @Nullable ObjectNode overrides) throws IOException {
        JsonNode tree = readDefaults();
        if (configFile != null) {
            JsonNode fileTree = mapper.readTree(configFile.toFile());
            if (fileTree != null && !fileTree.isMissingNode() && !fileTree.isNull()) {
                tree = deepMerge(tree, fileTree);
            }
        }
        if (overrides != null) tree = deepMerge(tree, overrides);
        return mapper.treeToValue(tree, ScanConfig.class);
    }

    private static JsonNode readDefaults() throws IOException {
        try (InputStream stream = ConfigLoader.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("defaults.yaml missing from classpath");
            return mapper.readTree(stream);
        }
    }

    public static String toYaml(ScanConfig config) throws IOException {
        return mapper.writeValueAsString(config);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and lists replace rather than merge
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), existing == null ? entry.getValue() : deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
