/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable capture of the matchable metadata of a window.
 *
 * <p>Snapshots are taken once per evaluation and never refreshed. Null strings
 * are stored as empty strings so that matchers never see null field values.
 *
 * @param handle         the window handle, empty when the window could not be identified
 * @param title          window title
 * @param className      native window class name
 * @param executablePath full path of the owning process' executable
 * @param processId      owning process id, an unsigned 32-bit value
 */
public record WindowSnapshot(
        Optional<WindowHandle> handle,
        String title,
        String className,
        String executablePath,
        long processId
) {
    public static final long MAX_PROCESS_ID = 0xFFFF_FFFFL;

    public WindowSnapshot {
        Objects.requireNonNull(handle, "handle cannot be null, use Optional.empty()");
        title = title == null ? "" : title;
        className = className == null ? "" : className;
        executablePath = executablePath == null ? "" : executablePath;
        if (processId < 0 || processId > MAX_PROCESS_ID) {
            throw new IllegalArgumentException("Process id out of range: " + processId);
        }
    }

    public WindowSnapshot(WindowHandle handle, String title, String className,
                          String executablePath, long processId) {
        this(Optional.ofNullable(handle), title, className, executablePath, processId);
    }

    /**
     * Name of the executable without directory and without its final extension,
     * e.g. {@code notepad} for {@code C:\Windows\notepad.exe}.
     */
    public String executableName() {
        int slash = Math.max(executablePath.lastIndexOf('\\'), executablePath.lastIndexOf('/'));
        String fileName = executablePath.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
