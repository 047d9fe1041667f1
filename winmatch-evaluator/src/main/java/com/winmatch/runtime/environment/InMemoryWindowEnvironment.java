package com.winmatch.runtime.environment;

import com.winmatch.api.IWindowDiscovery;
import com.winmatch.api.IWindowInspector;
import com.winmatch.api.IWindowMatch;
import com.winmatch.api.exceptions.WindowDiscoveryException;
import com.winmatch.api.model.DiscoveryMode;
import com.winmatch.api.model.WindowHandle;
import com.winmatch.api.model.WindowSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory window environment backed by registered snapshots.
 *
 * <p>Implements both collaborator contracts. Windows are discovered in
 * registration order; {@link DiscoveryMode#TOP_LEVEL} only returns windows
 * registered as top-level. Useful for tests and for callers that already hold
 * snapshots captured elsewhere.
 *
 * <p><b>Thread Safety:</b> All operations are synchronized on the environment.
 */
public class InMemoryWindowEnvironment implements IWindowInspector, IWindowDiscovery {

    private final Map<WindowHandle, Entry> windows = new LinkedHashMap<>();
    private WindowHandle activeHandle;

    /**
     * Registers a top-level window. The snapshot must carry a handle.
     */
    public synchronized InMemoryWindowEnvironment register(WindowSnapshot snapshot) {
        return register(snapshot, true);
    }

    /**
     * Registers a window, replacing any previous registration with the same handle.
     * A replaced window keeps its original position in discovery order.
     */
    public synchronized InMemoryWindowEnvironment register(WindowSnapshot snapshot, boolean topLevel) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        WindowHandle handle = snapshot.handle()
                .filter(WindowHandle::isValid)
                .orElseThrow(() -> new IllegalArgumentException("Registered windows need a non-zero handle"));
        windows.put(handle, new Entry(snapshot, topLevel));
        return this;
    }

    public synchronized boolean unregister(WindowHandle handle) {
        if (Objects.equals(activeHandle, handle)) {
            activeHandle = null;
        }
        return windows.remove(handle) != null;
    }

    /**
     * Marks a registered window as the focused one.
     */
    public synchronized void activate(WindowHandle handle) {
        if (!windows.containsKey(handle)) {
            throw new IllegalArgumentException("Unknown window: " + handle);
        }
        this.activeHandle = handle;
    }

    public synchronized Optional<WindowHandle> activeHandle() {
        return Optional.ofNullable(activeHandle);
    }

    @Override
    public synchronized WindowSnapshot snapshot(WindowHandle handle) {
        Entry entry = windows.get(handle);
        if (entry == null) {
            // A window that no longer exists reports nothing but its handle
            return new WindowSnapshot(handle, "", "", "", 0);
        }
        return entry.snapshot();
    }

    /**
     * Snapshot of the focused window; an empty, handle-less snapshot when none is focused.
     */
    @Override
    public synchronized WindowSnapshot activeWindowSnapshot() {
        if (activeHandle == null) {
            return new WindowSnapshot(Optional.empty(), "", "", "", 0);
        }
        return snapshot(activeHandle);
    }

    @Override
    public synchronized List<WindowHandle> discover(IWindowMatch match, DiscoveryMode mode) {
        Objects.requireNonNull(match, "match cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");

        List<WindowHandle> found = new ArrayList<>();
        for (Map.Entry<WindowHandle, Entry> e : windows.entrySet()) {
            Entry entry = e.getValue();
            if (mode == DiscoveryMode.TOP_LEVEL && !entry.topLevel()) {
                continue;
            }
            try {
                if (match.match(entry.snapshot())) {
                    found.add(e.getKey());
                }
            } catch (RuntimeException ex) {
                throw new WindowDiscoveryException("Match failed while discovering window " + e.getKey(), ex);
            }
        }
        return found;
    }

    public synchronized int size() {
        return windows.size();
    }

    private record Entry(WindowSnapshot snapshot, boolean topLevel) {}
}
