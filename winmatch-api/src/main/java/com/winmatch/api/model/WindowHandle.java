/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wrapper around a raw native window handle.
 *
 * <p>Record equality compares raw values, so two {@link #ZERO} handles are equal
 * as values. Use {@link #sameWindow(WindowHandle)} to ask whether two handles
 * point at the same live window: a zero handle never identifies one.
 */
public record WindowHandle(long raw) {

    /** A handle that points to nothing. */
    public static final WindowHandle ZERO = new WindowHandle(0L);

    /** A handle that addresses all top-level windows in some native calls. */
    public static final WindowHandle BROADCAST = new WindowHandle(0xffffL);

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WindowHandle of(long raw) {
        return raw == 0L ? ZERO : new WindowHandle(raw);
    }

    @JsonValue
    @Override
    public long raw() {
        return raw;
    }

    public boolean isZero() {
        return raw == 0L;
    }

    public boolean isValid() {
        return raw != 0L;
    }

    /**
     * True iff both handles carry the same non-zero raw value.
     */
    public boolean sameWindow(WindowHandle other) {
        return other != null && raw != 0L && raw == other.raw;
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(raw);
    }
}
