/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api;

import com.winmatch.api.model.DiscoveryMode;
import com.winmatch.api.model.WindowHandle;

import java.util.List;

/**
 * Collaborator that enumerates live windows.
 */
public interface IWindowDiscovery {

    /**
     * Returns every live window whose snapshot currently satisfies the match,
     * in the order the windowing system reports them.
     *
     * @param match the match to filter by (must not be null)
     * @param mode  whether to include nested and hidden windows
     * @return matching window handles, never null
     * @throws com.winmatch.api.exceptions.WindowDiscoveryException if enumeration fails
     */
    List<WindowHandle> discover(IWindowMatch match, DiscoveryMode mode);
}
