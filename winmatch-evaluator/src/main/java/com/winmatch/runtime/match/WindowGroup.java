package com.winmatch.runtime.match;

import com.winmatch.api.model.MatchDiscipline;
import com.winmatch.api.model.WindowHandle;
import com.winmatch.api.model.WindowSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A group of window matches combined through a whitelist and a blacklist.
 *
 * <p>A snapshot matches the group when no blacklist entry matches it and the
 * whitelist accepts it according to the group's {@link Combinator}. The reverse
 * flag is applied last, after the blacklist veto:
 * <pre>
 * result = !anyMatch(blacklist) &amp;&amp; combinator.accepts(whitelist)
 * return reverse ^ result
 * </pre>
 * An empty whitelist never accepts, for both combinators.
 *
 * <h2>Thread Safety</h2>
 * <p>{@link #match} only reads the tree and may be called concurrently as long
 * as nobody mutates it. Mutators ({@link #add}, {@link #remove},
 * {@link #setReverse}, direct edits of {@link #whitelist()}) are not
 * synchronized: callers that share a group between threads must lock around
 * mutation themselves.
 */
public final class WindowGroup implements WindowMatch {

    /**
     * How whitelist entries are combined. The blacklist is always "any entry vetoes".
     */
    public enum Combinator {
        /** At least one whitelist entry must match. */
        ANY_OF,
        /** The whitelist must be non-empty and every entry must match. */
        ALL_OF
    }

    private final Combinator combinator;
    private final List<WindowMatch> whitelist;
    private final List<WindowMatch> blacklist;
    private boolean reverse;

    public WindowGroup(Combinator combinator, WindowMatch... matches) {
        this.combinator = Objects.requireNonNull(combinator, "combinator cannot be null");
        this.whitelist = new ArrayList<>();
        this.blacklist = new ArrayList<>();
        if (matches != null) {
            add(matches);
        }
    }

    public static WindowGroup anyOf(WindowMatch... matches) {
        return new WindowGroup(Combinator.ANY_OF, matches);
    }

    public static WindowGroup allOf(WindowMatch... matches) {
        return new WindowGroup(Combinator.ALL_OF, matches);
    }

    /**
     * Matches the desktop window, whichever of its two class names is in use.
     * Returns a fresh group on every call.
     */
    public static WindowGroup desktop() {
        return anyOf(
                WindowCondition.builder().className("WorkerW").discipline(MatchDiscipline.FULL).build(),
                WindowCondition.builder().className("Progman").discipline(MatchDiscipline.FULL).build());
    }

    // ========================================================================
    // MATCHING
    // ========================================================================

    @Override
    public boolean match(WindowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        boolean result = !anyMatch(blacklist, snapshot) && acceptsWhitelist(snapshot);
        return reverse ^ result;
    }

    private boolean acceptsWhitelist(WindowSnapshot snapshot) {
        return switch (combinator) {
            case ANY_OF -> anyMatch(whitelist, snapshot);
            // An empty AND-group must not degrade into "match everything"
            case ALL_OF -> !whitelist.isEmpty() && allMatch(whitelist, snapshot);
        };
    }

    private static boolean anyMatch(List<WindowMatch> list, WindowSnapshot snapshot) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).match(snapshot)) {
                return true;
            }
        }
        return false;
    }

    private static boolean allMatch(List<WindowMatch> list, WindowSnapshot snapshot) {
        for (int i = 0; i < list.size(); i++) {
            if (!list.get(i).match(snapshot)) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // MUTATION
    // ========================================================================

    /** Appends entries to the whitelist. */
    public void add(WindowMatch... matches) {
        for (WindowMatch match : matches) {
            whitelist.add(Objects.requireNonNull(match, "whitelist entry cannot be null"));
        }
    }

    /** Appends one handle condition per window to the whitelist. */
    public void addWindows(WindowHandle... handles) {
        add(toConditions(handles));
    }

    /** Appends entries to the blacklist. */
    public void addBlacklist(WindowMatch... matches) {
        for (WindowMatch match : matches) {
            blacklist.add(Objects.requireNonNull(match, "blacklist entry cannot be null"));
        }
    }

    /** Appends one handle condition per window to the blacklist. */
    public void addBlacklistWindows(WindowHandle... handles) {
        addBlacklist(toConditions(handles));
    }

    private static WindowMatch[] toConditions(WindowHandle... handles) {
        return Arrays.stream(handles).map(WindowCondition::of).toArray(WindowMatch[]::new);
    }

    /**
     * Removes every whitelisted condition accepted by the filter, at any depth.
     * Nested groups whose whitelist is emptied by the removal are removed too.
     *
     * @return true if anything was removed
     * @throws NullPointerException if filter is null
     */
    public boolean remove(Predicate<WindowCondition> filter) {
        return removeFrom(whitelist, filter);
    }

    /**
     * Same as {@link #remove} but walks the blacklist. Nested groups found in the
     * blacklist are pruned through their own whitelist.
     */
    public boolean removeBlacklist(Predicate<WindowCondition> filter) {
        return removeFrom(blacklist, filter);
    }

    private static boolean removeFrom(List<WindowMatch> list, Predicate<WindowCondition> filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        boolean changed = false;

        for (Iterator<WindowMatch> it = list.iterator(); it.hasNext(); ) {
            WindowMatch child = it.next();
            if (child instanceof WindowCondition condition) {
                if (filter.test(condition)) {
                    it.remove();
                    changed = true;
                }
            } else if (child instanceof WindowGroup group && group.remove(filter)) {
                changed = true;
                if (group.size() == 0) {
                    it.remove();
                }
            }
        }

        return changed;
    }

    // ========================================================================
    // TREE OPERATIONS
    // ========================================================================

    @Override
    public boolean isReverse() {
        return reverse;
    }

    public void setReverse(boolean reverse) {
        this.reverse = reverse;
    }

    @Override
    public WindowGroup asReverse() {
        WindowGroup group = copy();
        group.reverse = !reverse;
        return group;
    }

    /**
     * Copies this group and every nested group. Conditions are immutable and
     * shared between the copies; no list is shared, so later mutation of
     * either tree never shows up in the other.
     */
    public WindowGroup copy() {
        WindowGroup group = new WindowGroup(combinator);
        copyInto(whitelist, group.whitelist);
        copyInto(blacklist, group.blacklist);
        group.reverse = reverse;
        return group;
    }

    private static void copyInto(List<WindowMatch> source, List<WindowMatch> target) {
        for (WindowMatch match : source) {
            target.add(match instanceof WindowGroup group ? group.copy() : match);
        }
    }

    @Override
    public List<WindowCondition> asList() {
        List<WindowCondition> conditions = new ArrayList<>();
        collect(this, conditions);
        return conditions;
    }

    private static void collect(WindowGroup group, List<WindowCondition> into) {
        for (WindowMatch match : group.whitelist) {
            if (match instanceof WindowCondition condition) {
                into.add(condition);
            } else if (match instanceof WindowGroup nested) {
                collect(nested, into);
            }
        }
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public Combinator getCombinator() {
        return combinator;
    }

    /** The live, mutable whitelist. */
    public List<WindowMatch> whitelist() {
        return whitelist;
    }

    /** The live, mutable blacklist. */
    public List<WindowMatch> blacklist() {
        return blacklist;
    }

    /** Number of entries in the whitelist. */
    public int size() {
        return whitelist.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowGroup that = (WindowGroup) o;
        return reverse == that.reverse &&
                combinator == that.combinator &&
                whitelist.equals(that.whitelist) &&
                blacklist.equals(that.blacklist);
    }

    @Override
    public int hashCode() {
        return Objects.hash(combinator, whitelist, blacklist, reverse);
    }

    @Override
    public String toString() {
        return combinator + "[whitelist=" + whitelist +
                ", blacklist=" + blacklist +
                (reverse ? ", reverse" : "") + ']';
    }
}
