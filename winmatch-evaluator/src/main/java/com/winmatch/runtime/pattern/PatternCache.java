package com.winmatch.runtime.pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.winmatch.api.exceptions.PatternException;
import com.winmatch.infra.config.MatchConfig;

import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded cache of compiled regular expressions, backed by Caffeine.
 *
 * <p>Conditions are often rebuilt from the same definitions (reloaded files,
 * desktop groups built per call), so identical pattern text is compiled once
 * and shared. {@link Pattern} instances are immutable and safe to share across threads.
 */
public final class PatternCache {
    private static final Logger logger = Logger.getLogger(PatternCache.class.getName());

    private static volatile PatternCache SHARED;
    private static final Object LOCK = new Object();

    private final Cache<PatternKey, Pattern> cache;
    private final int flags;

    public PatternCache(MatchConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getPatternCacheSize())
                .recordStats()
                .build();
        this.flags = config.isRegexCaseInsensitive()
                ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
                : 0;

        logger.fine(String.format("PatternCache initialized: maxSize=%d, caseInsensitive=%b",
                config.getPatternCacheSize(), config.isRegexCaseInsensitive()));
    }

    /**
     * Process-wide cache configured from the environment on first use.
     */
    public static PatternCache shared() {
        PatternCache instance = SHARED;
        if (instance == null) {
            synchronized (LOCK) {
                instance = SHARED;
                if (instance == null) {
                    instance = new PatternCache(MatchConfig.fromEnvironment());
                    SHARED = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Returns the compiled form of {@code regex}.
     *
     * @param field name of the criterion the pattern belongs to, used in error reports
     * @param regex the pattern text
     * @throws PatternException if the pattern is malformed
     */
    public Pattern compile(String field, String regex) {
        Objects.requireNonNull(regex, "regex cannot be null");
        try {
            return cache.get(new PatternKey(regex, flags), key -> Pattern.compile(key.regex(), key.flags()));
        } catch (PatternSyntaxException e) {
            throw new PatternException(field, regex, e);
        }
    }

    public boolean isCaseInsensitive() {
        return (flags & Pattern.CASE_INSENSITIVE) != 0;
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private record PatternKey(String regex, int flags) {}
}
