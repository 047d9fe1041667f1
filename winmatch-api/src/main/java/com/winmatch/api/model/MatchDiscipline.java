/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.model;

import java.util.Locale;

/**
 * Specifies how a condition's string criteria are compared against a window's metadata.
 */
public enum MatchDiscipline {
    /** The field must contain a match of the criterion read as a regular expression. */
    REGEX,
    /** The field must equal the criterion exactly. */
    FULL,
    /** The criterion must be contained in the field. */
    PARTIAL;

    /**
     * Safely converts a string to a discipline, ignoring case.
     * @return the discipline, or null if the text is null or unknown
     */
    public static MatchDiscipline fromString(String text) {
        if (text == null) return null;
        try {
            return MatchDiscipline.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
