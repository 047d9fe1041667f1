/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.exceptions;

/**
 * Exception thrown when a match definition cannot be turned into a predicate tree.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * on every caller that loads definitions.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
