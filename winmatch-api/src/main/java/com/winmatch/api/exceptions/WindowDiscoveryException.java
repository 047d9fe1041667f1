/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api.exceptions;

/**
 * Thrown by discovery collaborators when windows cannot be enumerated,
 * e.g. because the operating system denied the request.
 */
public class WindowDiscoveryException extends RuntimeException {

    public WindowDiscoveryException(String message) {
        super(message);
    }

    public WindowDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
