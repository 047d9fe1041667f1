/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.model;

import java.util.Locale;

/**
 * Scope of a window search.
 */
public enum DiscoveryMode {
    /** Only top-level application windows. */
    TOP_LEVEL,
    /** Every window, including nested and hidden ones. */
    ALL;

    public static DiscoveryMode fromString(String text) {
        if (text == null) return null;
        try {
            return DiscoveryMode.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
