package com.winmatch.runtime.match;

import com.winmatch.api.IWindowInspector;
import com.winmatch.api.IWindowMatch;

import java.util.List;

/**
 * A node of a window predicate tree: either a single {@link WindowCondition}
 * or a {@link WindowGroup} combining other nodes.
 *
 * <p>The hierarchy is sealed so tree walks can tell leaves from groups without
 * unchecked downcasts.
 */
public sealed interface WindowMatch extends IWindowMatch permits WindowCondition, WindowGroup {

    /**
     * True if the final result of {@link #match} is inverted.
     */
    boolean isReverse();

    /**
     * A copy of this match with the reverse flag inverted. The copy never
     * shares mutable state with this match.
     */
    WindowMatch asReverse();

    /**
     * The conditions this match could affirmatively match on: depth-first,
     * left to right over whitelists only.
     */
    List<WindowCondition> asList();

    /**
     * True if the currently focused window matches.
     */
    default boolean isActive(IWindowInspector inspector) {
        return match(inspector.activeWindowSnapshot());
    }

    /**
     * A new group that matches when either this or {@code other} matches.
     */
    default WindowGroup or(WindowMatch other) {
        return WindowGroup.anyOf(this, other);
    }

    /**
     * A new group that matches when both this and {@code other} match.
     */
    default WindowGroup and(WindowMatch other) {
        return WindowGroup.allOf(this, other);
    }
}
