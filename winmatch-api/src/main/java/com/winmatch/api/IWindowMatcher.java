/*
 * Copyright (c) 2025 WinMatch
 * Licensed under the Apache License, Version 2.0
 */
package com.winmatch.api;

import com.winmatch.api.model.DiscoveryMode;
import com.winmatch.api.model.WindowHandle;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Contract for evaluating matches against live windows.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IWindowMatcher matcher = // obtain from factory or DI
 *
 * WindowCondition notepad = WindowCondition.builder()
 *     .executableName("notepad")
 *     .discipline(MatchDiscipline.FULL)
 *     .build();
 *
 * boolean allVisited = matcher.forAll(notepad, handle -> {
 *     System.out.println("Found: " + handle);
 *     return true;
 * });
 * }</pre>
 *
 * <h2>Ordering</h2>
 * <p>All enumeration methods discover windows once and then visit them strictly
 * sequentially, in discovery order. Callbacks are never invoked concurrently.
 */
public interface IWindowMatcher {

    /**
     * Snapshots the window and checks it against the match.
     */
    boolean matches(IWindowMatch match, WindowHandle handle);

    /**
     * True if the currently focused window matches.
     */
    boolean isActive(IWindowMatch match);

    /**
     * All matching windows in discovery order.
     */
    List<WindowHandle> findAll(IWindowMatch match, DiscoveryMode mode);

    /**
     * The first matching window in discovery order, if any.
     */
    default Optional<WindowHandle> find(IWindowMatch match, DiscoveryMode mode) {
        return findAll(match, mode).stream().findFirst();
    }

    /**
     * Invokes the action for every matching window.
     */
    void forEach(IWindowMatch match, Consumer<WindowHandle> action, DiscoveryMode mode);

    /**
     * Invokes the action for matching windows until it returns false.
     *
     * @return true if every matching window was visited
     */
    boolean forAll(IWindowMatch match, Predicate<WindowHandle> action, DiscoveryMode mode);

    /**
     * Invokes an asynchronous action for matching windows one at a time,
     * waiting for each to complete, until one completes with false.
     *
     * @return a future completing with true if every matching window was visited,
     *         or completing exceptionally if discovery or any action failed
     */
    CompletableFuture<Boolean> forAllAsync(IWindowMatch match,
                                           Function<WindowHandle, ? extends CompletionStage<Boolean>> action,
                                           DiscoveryMode mode);
}
