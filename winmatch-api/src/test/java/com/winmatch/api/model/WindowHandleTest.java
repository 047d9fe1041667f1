/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WindowHandleTest {

    @Test
    void zeroHandleNeverIdentifiesAWindow() {
        assertThat(WindowHandle.ZERO.sameWindow(WindowHandle.of(0))).isFalse();
        assertThat(WindowHandle.ZERO.isZero()).isTrue();
        assertThat(WindowHandle.ZERO.isValid()).isFalse();
        // still equal as values
        assertThat(WindowHandle.of(0)).isEqualTo(WindowHandle.ZERO);
    }

    @Test
    void sameRawValueIdentifiesTheSameWindow() {
        assertThat(WindowHandle.of(0x1a2b).sameWindow(new WindowHandle(0x1a2b))).isTrue();
        assertThat(WindowHandle.of(0x1a2b).sameWindow(WindowHandle.of(0x1a2c))).isFalse();
        assertThat(WindowHandle.of(0x1a2b).sameWindow(null)).isFalse();
    }

    @Test
    void printsAsHex() {
        assertThat(WindowHandle.BROADCAST).hasToString("0xffff");
    }
}
