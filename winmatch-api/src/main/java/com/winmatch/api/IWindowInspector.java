/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api;

import com.winmatch.api.model.WindowHandle;
import com.winmatch.api.model.WindowSnapshot;

/**
 * Collaborator that captures metadata of live windows.
 *
 * <p>Implementations talk to the windowing system; the engine only consumes the
 * immutable snapshots they return.
 */
public interface IWindowInspector {

    /**
     * Captures the current metadata of the given window.
     *
     * @param handle the window to inspect
     * @return an immutable snapshot
     */
    WindowSnapshot snapshot(WindowHandle handle);

    /**
     * Captures the currently focused window.
     */
    WindowSnapshot activeWindowSnapshot();
}
