/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.exceptions;

/**
 * Thrown when a regular-expression criterion cannot be compiled.
 *
 * <p>Raised when the condition carrying the criterion is built, never turned
 * into a silent "no match".
 */
public class PatternException extends RuntimeException {

    private final String field;
    private final String pattern;

    public PatternException(String field, String pattern, Throwable cause) {
        super("Invalid regex for " + field + ": '" + pattern + "'"
                + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.field = field;
        this.pattern = pattern;
    }

    /** Name of the criterion that carried the pattern, e.g. {@code title}. */
    public String getField() {
        return field;
    }

    public String getPattern() {
        return pattern;
    }
}
