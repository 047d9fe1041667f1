package com.winmatch.runtime.pattern;

import com.winmatch.api.exceptions.PatternException;
import com.winmatch.infra.config.MatchConfig;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternCacheTest {

    @Test
    void shouldReuseCompiledPatterns() {
        PatternCache cache = new PatternCache(MatchConfig.defaults());

        Pattern first = cache.compile("title", "^Chrome.*");
        Pattern second = cache.compile("className", "^Chrome.*");

        assertThat(second).isSameAs(first);
        assertThat(cache.stats().hitCount()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreCaseByDefault() {
        PatternCache cache = new PatternCache(MatchConfig.defaults());

        assertThat(cache.isCaseInsensitive()).isTrue();
        assertThat(cache.compile("title", "notepad").matcher("Untitled - NOTEPAD").find()).isTrue();
    }

    @Test
    void shouldHonourCaseSensitiveConfig() {
        PatternCache cache = new PatternCache(MatchConfig.defaults().toBuilder()
                .regexCaseInsensitive(false)
                .build());

        assertThat(cache.isCaseInsensitive()).isFalse();
        assertThat(cache.compile("title", "notepad").matcher("Untitled - NOTEPAD").find()).isFalse();
    }

    @Test
    void shouldReportMalformedPatterns() {
        PatternCache cache = new PatternCache(MatchConfig.defaults());

        assertThatThrownBy(() -> cache.compile("executablePath", "*.exe"))
                .isInstanceOf(PatternException.class)
                .hasMessageContaining("executablePath")
                .hasMessageContaining("*.exe");
    }

    @Test
    void sharedCacheIsASingleton() {
        assertThat(PatternCache.shared()).isSameAs(PatternCache.shared());
    }
}
