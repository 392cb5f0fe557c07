package io.surfworks.graphmatch.match;

import java.nio.file.Path;

/**
 * Configuration for {@link SubgraphMatchFinder}.
 *
 * <p>Loaded by {@link MatcherConfigLoader} from
 * {@code ~/.config/graphmatch/matcher.json}; fields missing from the file keep
 * their defaults.
 *
 * @param maxMatches    stop after this many matches; 0 means unlimited
 * @param traceAttempts log every anchor attempt at {@code FINEST}
 */
public record MatcherConfig(
        int maxMatches,
        boolean traceAttempts
) {

    /** No cap on reported matches */
    public static final int UNLIMITED = 0;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "graphmatch"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "matcher.json";

    /** System property overriding the config file location */
    public static final String CONFIG_PROPERTY = "graphmatch.config";

    public MatcherConfig {
        if (maxMatches < 0) {
            throw new IllegalArgumentException("maxMatches must be >= 0, got " + maxMatches);
        }
    }

    public static MatcherConfig defaults() {
        return new MatcherConfig(UNLIMITED, false);
    }

    /**
     * Returns the config file path, honouring the {@value #CONFIG_PROPERTY}
     * system property.
     */
    public static Path configFile() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public boolean isLimited() {
        return maxMatches != UNLIMITED;
    }

    public MatcherConfig withMaxMatches(int max) {
        return new MatcherConfig(max, traceAttempts);
    }

    public MatcherConfig withTraceAttempts(boolean trace) {
        return new MatcherConfig(maxMatches, trace);
    }
}
