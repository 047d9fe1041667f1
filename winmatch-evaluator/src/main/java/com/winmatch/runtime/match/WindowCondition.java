package com.winmatch.runtime.match;

import com.winmatch.api.model.MatchDiscipline;
import com.winmatch.api.model.WindowHandle;
import com.winmatch.api.model.WindowSnapshot;
import com.winmatch.runtime.pattern.PatternCache;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A condition on a single window: optional criteria on handle, title, class
 * name, executable name, executable path and process id.
 *
 * <p>A condition matches a snapshot iff every criterion it carries holds. Absent
 * criteria always hold, so a condition without criteria matches every window.
 * One {@link MatchDiscipline} governs all string criteria; handle and process id
 * are always compared exactly. A process id of 0 means "no criterion".
 *
 * <p>Instances are immutable. Regular expressions are compiled when the
 * condition is built, so a malformed pattern fails the build with a
 * {@link com.winmatch.api.exceptions.PatternException}.
 */
public final class WindowCondition implements WindowMatch {

    private final WindowHandle handle;
    private final String title;
    private final String className;
    private final String executableName;
    private final String executablePath;
    private final long processId;
    private final MatchDiscipline discipline;
    private final boolean reverse;

    // Compiled criteria, only populated for REGEX
    private final Pattern titlePattern;
    private final Pattern classNamePattern;
    private final Pattern executableNamePattern;
    private final Pattern executablePathPattern;

    private WindowCondition(Builder builder) {
        if (builder.processId < 0 || builder.processId > WindowSnapshot.MAX_PROCESS_ID) {
            throw new IllegalArgumentException("Process id out of range: " + builder.processId);
        }
        this.handle = builder.handle;
        this.title = builder.title;
        this.className = builder.className;
        this.executableName = builder.executableName;
        this.executablePath = builder.executablePath;
        this.processId = builder.processId;
        this.discipline = Objects.requireNonNull(builder.discipline, "discipline cannot be null");
        this.reverse = builder.reverse;

        PatternCache patterns = builder.patternCache != null ? builder.patternCache : PatternCache.shared();
        this.titlePattern = compile(patterns, "title", title);
        this.classNamePattern = compile(patterns, "className", className);
        this.executableNamePattern = compile(patterns, "executableName", executableName);
        this.executablePathPattern = compile(patterns, "executablePath", executablePath);
    }

    private WindowCondition(WindowCondition source, boolean reverse) {
        this.handle = source.handle;
        this.title = source.title;
        this.className = source.className;
        this.executableName = source.executableName;
        this.executablePath = source.executablePath;
        this.processId = source.processId;
        this.discipline = source.discipline;
        this.reverse = reverse;
        this.titlePattern = source.titlePattern;
        this.classNamePattern = source.classNamePattern;
        this.executableNamePattern = source.executableNamePattern;
        this.executablePathPattern = source.executablePathPattern;
    }

    private Pattern compile(PatternCache patterns, String field, String criterion) {
        if (criterion == null || discipline != MatchDiscipline.REGEX) {
            return null;
        }
        return patterns.compile(field, criterion);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A condition matching exactly the window with the given handle.
     */
    public static WindowCondition of(WindowHandle handle) {
        return builder().handle(Objects.requireNonNull(handle, "handle cannot be null")).build();
    }

    // ========================================================================
    // MATCHING
    // ========================================================================

    @Override
    public boolean match(WindowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        boolean result = matchesHandle(snapshot)
                && (className == null || matchString(snapshot.className(), className, classNamePattern))
                && (processId == 0 || processId == snapshot.processId())
                && (executableName == null || matchString(snapshot.executableName(), executableName, executableNamePattern))
                && (executablePath == null || matchString(snapshot.executablePath(), executablePath, executablePathPattern))
                && (title == null || matchString(snapshot.title(), title, titlePattern));
        return reverse ^ result;
    }

    private boolean matchesHandle(WindowSnapshot snapshot) {
        return handle == null || snapshot.handle().map(handle::sameWindow).orElse(false);
    }

    private boolean matchString(String value, String criterion, Pattern pattern) {
        return switch (discipline) {
            case REGEX -> pattern.matcher(value).find();
            case FULL -> criterion.equals(value);
            case PARTIAL -> value.contains(criterion);
        };
    }

    // Single-field checks. Each honours the reverse flag and treats an absent criterion as a match.

    public boolean matchHandle(WindowHandle candidate) {
        return reverse ^ (handle == null || handle.sameWindow(candidate));
    }

    public boolean matchTitle(String value) {
        return reverse ^ (title == null || matchString(nullToEmpty(value), title, titlePattern));
    }

    public boolean matchClassName(String value) {
        return reverse ^ (className == null || matchString(nullToEmpty(value), className, classNamePattern));
    }

    public boolean matchExecutableName(String value) {
        return reverse ^ (executableName == null
                || matchString(nullToEmpty(value), executableName, executableNamePattern));
    }

    public boolean matchExecutablePath(String value) {
        return reverse ^ (executablePath == null
                || matchString(nullToEmpty(value), executablePath, executablePathPattern));
    }

    public boolean matchProcessId(long value) {
        return reverse ^ (processId == 0 || processId == value);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    // ========================================================================
    // TREE OPERATIONS
    // ========================================================================

    @Override
    public boolean isReverse() {
        return reverse;
    }

    @Override
    public WindowCondition asReverse() {
        return new WindowCondition(this, !reverse);
    }

    @Override
    public List<WindowCondition> asList() {
        return List.of(this);
    }

    /**
     * True if the condition carries no criteria at all.
     */
    public boolean isEmpty() {
        return handle == null && title == null && className == null
                && executableName == null && executablePath == null && processId == 0;
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public WindowHandle getHandle() { return handle; }
    public String getTitle() { return title; }
    public String getClassName() { return className; }
    public String getExecutableName() { return executableName; }
    public String getExecutablePath() { return executablePath; }
    public long getProcessId() { return processId; }
    public MatchDiscipline getDiscipline() { return discipline; }

    /**
     * Overridden equals for logical condition equality.
     * Compiled patterns are derived from the criteria and not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowCondition that = (WindowCondition) o;
        return processId == that.processId &&
                reverse == that.reverse &&
                discipline == that.discipline &&
                Objects.equals(handle, that.handle) &&
                Objects.equals(title, that.title) &&
                Objects.equals(className, that.className) &&
                Objects.equals(executableName, that.executableName) &&
                Objects.equals(executablePath, that.executablePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handle, title, className, executableName, executablePath, processId, discipline, reverse);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WindowCondition[");
        if (handle != null) sb.append("handle=").append(handle).append(", ");
        if (title != null) sb.append("title='").append(title).append("', ");
        if (className != null) sb.append("className='").append(className).append("', ");
        if (executableName != null) sb.append("exe='").append(executableName).append("', ");
        if (executablePath != null) sb.append("exePath='").append(executablePath).append("', ");
        if (processId != 0) sb.append("pid=").append(processId).append(", ");
        sb.append("discipline=").append(discipline);
        if (reverse) sb.append(", reverse");
        return sb.append(']').toString();
    }

    public static class Builder {
        private WindowHandle handle;
        private String title;
        private String className;
        private String executableName;
        private String executablePath;
        private long processId;
        private MatchDiscipline discipline = MatchDiscipline.REGEX;
        private boolean reverse;
        private PatternCache patternCache;

        private Builder() {
        }

        public Builder handle(WindowHandle handle) {
            this.handle = handle;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        /**
         * Executable file name without directory and extension, e.g. {@code notepad}.
         */
        public Builder executableName(String executableName) {
            this.executableName = executableName;
            return this;
        }

        public Builder executablePath(String executablePath) {
            this.executablePath = executablePath;
            return this;
        }

        public Builder processId(long processId) {
            this.processId = processId;
            return this;
        }

        public Builder discipline(MatchDiscipline discipline) {
            this.discipline = discipline;
            return this;
        }

        public Builder reverse(boolean reverse) {
            this.reverse = reverse;
            return this;
        }

        /**
         * Cache used to compile regex criteria. Defaults to {@link PatternCache#shared()}.
         */
        public Builder patternCache(PatternCache patternCache) {
            this.patternCache = patternCache;
            return this;
        }

        /**
         * @throws com.winmatch.api.exceptions.PatternException if a regex criterion is malformed
         */
        public WindowCondition build() {
            return new WindowCondition(this);
        }
    }
}
