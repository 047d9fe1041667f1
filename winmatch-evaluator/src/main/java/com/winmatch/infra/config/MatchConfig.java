package com.winmatch.infra.config;

import com.winmatch.api.model.DiscoveryMode;
import com.winmatch.api.model.MatchDiscipline;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Configuration for matching and enumeration.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables, falling back to
 * a system property of the same name:
 * <pre>
 * WINMATCH_PATTERN_CACHE_SIZE=4096
 * WINMATCH_REGEX_CASE_INSENSITIVE=false
 * WINMATCH_DEFAULT_DISCOVERY_MODE=ALL
 * WINMATCH_DEFAULT_DISCIPLINE=PARTIAL
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * MatchConfig config = MatchConfig.fromEnvironment();
 *
 * MatchConfig custom = MatchConfig.builder()
 *     .patternCacheSize(256)
 *     .defaultDiscoveryMode(DiscoveryMode.ALL)
 *     .build();
 * }</pre>
 */
public final class MatchConfig {

    private static final Logger logger = Logger.getLogger(MatchConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_PATTERN_CACHE_SIZE = "WINMATCH_PATTERN_CACHE_SIZE";
    static final String ENV_REGEX_CASE_INSENSITIVE = "WINMATCH_REGEX_CASE_INSENSITIVE";
    static final String ENV_DEFAULT_DISCOVERY_MODE = "WINMATCH_DEFAULT_DISCOVERY_MODE";
    static final String ENV_DEFAULT_DISCIPLINE = "WINMATCH_DEFAULT_DISCIPLINE";

    private final long patternCacheSize;
    private final boolean regexCaseInsensitive;
    private final DiscoveryMode defaultDiscoveryMode;
    private final MatchDiscipline defaultDiscipline;

    private MatchConfig(Builder builder) {
        this.patternCacheSize = builder.patternCacheSize;
        this.regexCaseInsensitive = builder.regexCaseInsensitive;
        this.defaultDiscoveryMode = Objects.requireNonNull(builder.defaultDiscoveryMode, "defaultDiscoveryMode");
        this.defaultDiscipline = Objects.requireNonNull(builder.defaultDiscipline, "defaultDiscipline");
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults overridden by whatever environment variables or system properties are set.
     */
    public static MatchConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Plain defaults, ignoring the environment. Useful in tests.
     */
    public static MatchConfig defaults() {
        return new Builder(false).build();
    }

    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Create a builder initialized with this configuration's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.patternCacheSize = this.patternCacheSize;
        builder.regexCaseInsensitive = this.regexCaseInsensitive;
        builder.defaultDiscoveryMode = this.defaultDiscoveryMode;
        builder.defaultDiscipline = this.defaultDiscipline;
        return builder;
    }

    public static class Builder {

        private long patternCacheSize = 1024;
        private boolean regexCaseInsensitive = true;
        private DiscoveryMode defaultDiscoveryMode = DiscoveryMode.TOP_LEVEL;
        private MatchDiscipline defaultDiscipline = MatchDiscipline.REGEX;

        private Builder(boolean loadEnvironment) {
            if (loadEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnvLong(ENV_PATTERN_CACHE_SIZE).ifPresent(val -> {
                if (val <= 0) {
                    logger.warning("Invalid " + ENV_PATTERN_CACHE_SIZE + ": " + val
                            + " (must be positive), using default: " + this.patternCacheSize);
                } else {
                    this.patternCacheSize = val;
                }
            });
            getEnvBoolean(ENV_REGEX_CASE_INSENSITIVE).ifPresent(val -> this.regexCaseInsensitive = val);
            getEnv(ENV_DEFAULT_DISCOVERY_MODE).ifPresent(val -> {
                DiscoveryMode mode = DiscoveryMode.fromString(val);
                if (mode == null) {
                    logger.warning("Invalid " + ENV_DEFAULT_DISCOVERY_MODE + ": " + val
                            + ", using default: " + this.defaultDiscoveryMode);
                } else {
                    this.defaultDiscoveryMode = mode;
                }
            });
            getEnv(ENV_DEFAULT_DISCIPLINE).ifPresent(val -> {
                MatchDiscipline discipline = MatchDiscipline.fromString(val);
                if (discipline == null) {
                    logger.warning("Invalid " + ENV_DEFAULT_DISCIPLINE + ": " + val
                            + ", using default: " + this.defaultDiscipline);
                } else {
                    this.defaultDiscipline = discipline;
                }
            });
        }

        public Builder patternCacheSize(long size) {
            this.patternCacheSize = size;
            return this;
        }

        public Builder regexCaseInsensitive(boolean caseInsensitive) {
            this.regexCaseInsensitive = caseInsensitive;
            return this;
        }

        public Builder defaultDiscoveryMode(DiscoveryMode mode) {
            this.defaultDiscoveryMode = mode;
            return this;
        }

        public Builder defaultDiscipline(MatchDiscipline discipline) {
            this.defaultDiscipline = discipline;
            return this;
        }

        public MatchConfig build() {
            return new MatchConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded setting: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Boolean> getEnvBoolean(String key) {
            return getEnv(key).map(val -> {
                switch (val.toLowerCase(Locale.ROOT)) {
                    case "true", "1", "yes":
                        return Boolean.TRUE;
                    case "false", "0", "no":
                        return Boolean.FALSE;
                    default:
                        logger.warning("Invalid boolean value for " + key + ": " + val);
                        return null;
                }
            });
        }
    }

    private void validate() {
        if (patternCacheSize <= 0) {
            throw new IllegalArgumentException("patternCacheSize must be positive: " + patternCacheSize);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public long getPatternCacheSize() { return patternCacheSize; }
    public boolean isRegexCaseInsensitive() { return regexCaseInsensitive; }
    public DiscoveryMode getDefaultDiscoveryMode() { return defaultDiscoveryMode; }
    public MatchDiscipline getDefaultDiscipline() { return defaultDiscipline; }

    @Override
    public String toString() {
        return "MatchConfig{" +
                "patternCacheSize=" + patternCacheSize +
                ", regexCaseInsensitive=" + regexCaseInsensitive +
                ", defaultDiscoveryMode=" + defaultDiscoveryMode +
                ", defaultDiscipline=" + defaultDiscipline +
                '}';
    }
}
