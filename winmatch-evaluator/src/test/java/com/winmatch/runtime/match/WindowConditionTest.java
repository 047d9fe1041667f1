package com.winmatch.runtime.match;

import com.winmatch.api.exceptions.PatternException;
import com.winmatch.api.model.MatchDiscipline;
import com.winmatch.api.model.WindowHandle;
import com.winmatch.api.model.WindowSnapshot;
import com.winmatch.infra.config.MatchConfig;
import com.winmatch.runtime.pattern.PatternCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowConditionTest {

    private static final WindowSnapshot NOTEPAD = new WindowSnapshot(
            WindowHandle.of(0x10010), "Untitled - Notepad", "Notepad",
            "C:\\Windows\\System32\\notepad.exe", 4242);

    private static WindowSnapshot titled(String title) {
        return new WindowSnapshot(WindowHandle.of(0x20020), title, "Chrome_WidgetWin_1",
                "C:\\Program Files\\Google\\Chrome\\chrome.exe", 777);
    }

    @Nested
    @DisplayName("String disciplines")
    class Disciplines {

        @Test
        @DisplayName("PARTIAL matches a substring but FULL requires the whole title")
        void partialVersusFull() {
            WindowCondition partial = WindowCondition.builder()
                    .title("Notepad").discipline(MatchDiscipline.PARTIAL).build();
            WindowCondition full = WindowCondition.builder()
                    .title("Notepad").discipline(MatchDiscipline.FULL).build();

            assertThat(partial.match(NOTEPAD)).isTrue();
            assertThat(full.match(NOTEPAD)).isFalse();
        }

        @Test
        @DisplayName("FULL matches an identical title")
        void fullMatchesIdenticalTitle() {
            WindowCondition full = WindowCondition.builder()
                    .title("Untitled - Notepad").discipline(MatchDiscipline.FULL).build();

            assertThat(full.match(NOTEPAD)).isTrue();
        }

        @Test
        @DisplayName("FULL and PARTIAL are case-sensitive")
        void fullAndPartialAreCaseSensitive() {
            assertThat(WindowCondition.builder().title("notepad").discipline(MatchDiscipline.PARTIAL).build()
                    .match(NOTEPAD)).isFalse();
            assertThat(WindowCondition.builder().title("untitled - notepad").discipline(MatchDiscipline.FULL).build()
                    .match(NOTEPAD)).isFalse();
        }

        @Test
        @DisplayName("REGEX honours anchors")
        void regexHonoursAnchors() {
            WindowCondition chrome = WindowCondition.builder()
                    .title("^Chrome.*").discipline(MatchDiscipline.REGEX).build();

            assertThat(chrome.match(titled("Chrome Browser"))).isTrue();
            assertThat(chrome.match(titled("Google Chrome"))).isFalse();
        }

        @Test
        @DisplayName("REGEX finds the pattern anywhere when unanchored, ignoring case")
        void regexFindsUnanchoredIgnoringCase() {
            WindowCondition condition = WindowCondition.builder().title("notepad").build();

            assertThat(condition.getDiscipline()).isEqualTo(MatchDiscipline.REGEX);
            assertThat(condition.match(NOTEPAD)).isTrue();
        }

        @Test
        @DisplayName("REGEX respects a case-sensitive pattern cache")
        void regexCaseSensitiveWhenConfigured() {
            PatternCache caseSensitive = new PatternCache(MatchConfig.defaults().toBuilder()
                    .regexCaseInsensitive(false).build());
            WindowCondition condition = WindowCondition.builder()
                    .title("notepad").patternCache(caseSensitive).build();

            assertThat(condition.match(NOTEPAD)).isFalse();
        }

        @Test
        @DisplayName("The discipline applies to every string criterion")
        void disciplineAppliesToAllStringFields() {
            WindowCondition condition = WindowCondition.builder()
                    .className("Note")
                    .executablePath("System32")
                    .title("Untitled")
                    .discipline(MatchDiscipline.PARTIAL)
                    .build();

            assertThat(condition.match(NOTEPAD)).isTrue();
        }
    }

    @Nested
    @DisplayName("Criteria")
    class Criteria {

        @Test
        @DisplayName("A condition without criteria matches everything")
        void emptyConditionMatchesEverything() {
            WindowCondition any = WindowCondition.builder().build();

            assertThat(any.isEmpty()).isTrue();
            assertThat(any.match(NOTEPAD)).isTrue();
            assertThat(any.match(new WindowSnapshot(Optional.empty(), "", "", "", 0))).isTrue();
        }

        @Test
        @DisplayName("All configured criteria must hold")
        void allCriteriaMustHold() {
            WindowCondition condition = WindowCondition.builder()
                    .title("Notepad")
                    .processId(4242)
                    .discipline(MatchDiscipline.PARTIAL)
                    .build();
            WindowCondition wrongPid = WindowCondition.builder()
                    .title("Notepad")
                    .processId(4243)
                    .discipline(MatchDiscipline.PARTIAL)
                    .build();

            assertThat(condition.match(NOTEPAD)).isTrue();
            assertThat(wrongPid.match(NOTEPAD)).isFalse();
        }

        @Test
        @DisplayName("Handle equality is exact and needs a handle on the snapshot")
        void handleEquality() {
            WindowCondition byHandle = WindowCondition.of(WindowHandle.of(0x10010));

            assertThat(byHandle.match(NOTEPAD)).isTrue();
            assertThat(byHandle.match(titled("x"))).isFalse();
            assertThat(byHandle.match(new WindowSnapshot(Optional.empty(), "Untitled - Notepad", "Notepad", "", 4242)))
                    .isFalse();
        }

        @Test
        @DisplayName("A zero handle criterion never matches")
        void zeroHandleNeverMatches() {
            WindowCondition zero = WindowCondition.of(WindowHandle.ZERO);

            assertThat(zero.match(new WindowSnapshot(WindowHandle.ZERO, "", "", "", 0))).isFalse();
        }

        @Test
        @DisplayName("Executable name is matched without directory and extension")
        void executableName() {
            WindowCondition exe = WindowCondition.builder()
                    .executableName("notepad").discipline(MatchDiscipline.FULL).build();

            assertThat(exe.match(NOTEPAD)).isTrue();
            assertThat(exe.match(titled("Chrome"))).isFalse();
        }

        @Test
        @DisplayName("Process ids outside the unsigned 32-bit range are rejected")
        void rejectsInvalidProcessId() {
            assertThatThrownBy(() -> WindowCondition.builder().processId(-5).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Regex errors")
    class RegexErrors {

        @Test
        @DisplayName("A malformed pattern fails at construction with the field name")
        void malformedPatternFailsEagerly() {
            assertThatThrownBy(() -> WindowCondition.builder().className("([a-z").build())
                    .isInstanceOf(PatternException.class)
                    .satisfies(e -> {
                        PatternException pe = (PatternException) e;
                        assertThat(pe.getField()).isEqualTo("className");
                        assertThat(pe.getPattern()).isEqualTo("([a-z");
                    });
        }

        @Test
        @DisplayName("Non-regex disciplines never compile the criterion")
        void nonRegexDisciplineAcceptsAnyText() {
            WindowCondition literal = WindowCondition.builder()
                    .title("([a-z").discipline(MatchDiscipline.PARTIAL).build();

            assertThat(literal.match(titled("group ([a-z in title"))).isTrue();
        }
    }

    @Nested
    @DisplayName("Reverse")
    class Reverse {

        @Test
        @DisplayName("asReverse inverts the result and leaves the original untouched")
        void asReverseInverts() {
            WindowCondition condition = WindowCondition.builder()
                    .title("Notepad").discipline(MatchDiscipline.PARTIAL).build();
            WindowCondition reversed = condition.asReverse();

            assertThat(reversed.isReverse()).isTrue();
            assertThat(condition.isReverse()).isFalse();
            assertThat(reversed.match(NOTEPAD)).isEqualTo(!condition.match(NOTEPAD));
            assertThat(reversed.match(titled("x"))).isEqualTo(!condition.match(titled("x")));
            assertThat(reversed.asReverse()).isEqualTo(condition);
        }

        @Test
        @DisplayName("Single-field checks honour reverse")
        void singleFieldChecks() {
            WindowCondition condition = WindowCondition.builder()
                    .title("Notepad")
                    .processId(4242)
                    .discipline(MatchDiscipline.PARTIAL)
                    .build();

            assertThat(condition.matchTitle("Untitled - Notepad")).isTrue();
            assertThat(condition.matchProcessId(1)).isFalse();
            assertThat(condition.matchClassName("anything")).isTrue();
            assertThat(condition.asReverse().matchTitle("Untitled - Notepad")).isFalse();
            assertThat(condition.asReverse().matchHandle(WindowHandle.of(5))).isFalse();
        }
    }

    @Test
    @DisplayName("asList of a condition is the condition itself")
    void asListIsSelf() {
        WindowCondition condition = WindowCondition.builder().title("a").build();

        assertThat(condition.asList()).containsExactly(condition);
    }
}
