package io.surfworks.graphmatch.match;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves {@link MatcherConfig}.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Config file ({@code -Dgraphmatch.config=...} or {@code ~/.config/graphmatch/matcher.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>A file that cannot be read or parsed is logged and ignored.
 */
public final class MatcherConfigLoader {

    private static final Logger LOG = Logger.getLogger(MatcherConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private MatcherConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * @return the loaded configuration
     */
    public static MatcherConfig load() {
        return load(MatcherConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration, or defaults if the file does not exist
     */
    public static MatcherConfig load(Path configFile) {
        MatcherConfig config = MatcherConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(MatcherConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("maxMatches", config.maxMatches());
        root.put("traceAttempts", config.traceAttempts());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static MatcherConfig loadFromFile(Path configFile, MatcherConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring " + configFile + ": expected a JSON object");
                return base;
            }

            MatcherConfig config = base;
            if (root.has("maxMatches")) {
                config = config.withMaxMatches(root.get("maxMatches").asInt(base.maxMatches()));
            }
            if (root.has("traceAttempts")) {
                config = config.withTraceAttempts(root.get("traceAttempts").asBoolean(base.traceAttempts()));
            }
            LOG.fine("Loaded matcher config from " + configFile + ": " + config);
            return config;

        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Could not read matcher config " + configFile + ", using defaults", e);
            return base;
        }
    }
}
