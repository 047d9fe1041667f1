package com.winmatch.compiler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.winmatch.api.model.WindowHandle;

import java.util.List;
import java.util.Locale;

/**
 * JSON representation of a match tree node.
 * This is a simple Data Transfer Object (DTO) used for loading and saving.
 *
 * <p>A node is either a condition ({@code "type": "condition"}, the default)
 * carrying criteria, or a group ({@code "any_of"} / {@code "all_of"}) carrying
 * whitelist and blacklist entries.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchDefinition(
        @JsonProperty("type") String type,
        @JsonProperty("handle") WindowHandle handle,
        @JsonProperty("title") String title,
        @JsonProperty("class_name") String className,
        @JsonProperty("exe") String exe,
        @JsonProperty("exe_path") String exePath,
        @JsonProperty("pid") Long pid,
        @JsonProperty("discipline") String discipline,
        @JsonProperty("reverse") Boolean reverse,
        @JsonProperty("whitelist") List<MatchDefinition> whitelist,
        @JsonProperty("blacklist") List<MatchDefinition> blacklist
) {
    public static final String TYPE_CONDITION = "condition";
    public static final String TYPE_ANY_OF = "any_of";
    public static final String TYPE_ALL_OF = "all_of";

    // Default values for optional fields

    public String type() {
        return type != null ? type.trim().toLowerCase(Locale.ROOT) : TYPE_CONDITION;
    }

    // Written only when set
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public Boolean reverse() {
        return reverse != null ? reverse : false;
    }

    /**
     * True if any condition-only field is set.
     */
    @JsonIgnore
    public boolean hasCriteria() {
        return handle != null || title != null || className != null || exe != null
                || exePath != null || pid != null || discipline != null;
    }

    public static MatchDefinition condition(WindowHandle handle, String title, String className, String exe,
                                            String exePath, Long pid, String discipline, Boolean reverse) {
        return new MatchDefinition(TYPE_CONDITION, handle, title, className, exe, exePath, pid, discipline,
                reverse, null, null);
    }

    public static MatchDefinition group(String type, Boolean reverse,
                                        List<MatchDefinition> whitelist, List<MatchDefinition> blacklist) {
        return new MatchDefinition(type, null, null, null, null, null, null, null, reverse, whitelist, blacklist);
    }
}
