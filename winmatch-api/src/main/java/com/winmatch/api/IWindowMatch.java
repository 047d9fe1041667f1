/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api;

import com.winmatch.api.model.WindowSnapshot;

/**
 * Contract for anything that can decide whether a window snapshot matches.
 *
 * <p>This is the type discovery collaborators receive, so they only depend on
 * the API module and never on a concrete predicate tree.
 */
@FunctionalInterface
public interface IWindowMatch {

    /**
     * Checks the snapshot against this match.
     *
     * @param snapshot the captured window metadata (must not be null)
     * @return true if the window described by the snapshot matches
     */
    boolean match(WindowSnapshot snapshot);
}
