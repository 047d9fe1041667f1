package com.winmatch.runtime.evaluation;

import com.winmatch.api.IWindowDiscovery;
import com.winmatch.api.IWindowInspector;
import com.winmatch.api.IWindowMatch;
import com.winmatch.api.IWindowMatcher;
import com.winmatch.api.model.DiscoveryMode;
import com.winmatch.api.model.WindowHandle;
import com.winmatch.infra.config.MatchConfig;
import com.winmatch.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Evaluates matches against live windows through the inspector and discovery collaborators.
 *
 * <h2>Enumeration</h2>
 * <p>Each enumeration calls {@link IWindowDiscovery#discover} exactly once and
 * then visits the returned windows strictly in order, one at a time:
 * <ul>
 *   <li>{@link #forEach} visits every window</li>
 *   <li>{@link #forAll} stops at the first callback returning false</li>
 *   <li>{@link #forAllAsync} waits for each callback's stage before starting the next</li>
 * </ul>
 * Failures from discovery or from a callback propagate to the caller. Windows
 * visited before the failure keep whatever the callback did to them; nothing
 * is retried.
 *
 * <h2>Thread Safety</h2>
 * <p>The matcher holds no per-call state and may be shared. It owns no threads:
 * any asynchrony comes from the stages the caller's callbacks return.
 */
public class WindowMatcher implements IWindowMatcher {
    private static final Logger logger = Logger.getLogger(WindowMatcher.class.getName());

    private final IWindowInspector inspector;
    private final IWindowDiscovery discovery;
    private final Tracer tracer;
    private final DiscoveryMode defaultMode;

    public WindowMatcher(IWindowInspector inspector, IWindowDiscovery discovery, Tracer tracer, MatchConfig config) {
        this.inspector = Objects.requireNonNull(inspector, "inspector cannot be null");
        this.discovery = Objects.requireNonNull(discovery, "discovery cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.defaultMode = config.getDefaultDiscoveryMode();
    }

    public WindowMatcher(IWindowInspector inspector, IWindowDiscovery discovery, Tracer tracer) {
        this(inspector, discovery, tracer, MatchConfig.fromEnvironment());
    }

    /**
     * Uses the process-wide tracer and environment configuration.
     */
    public WindowMatcher(IWindowInspector inspector, IWindowDiscovery discovery) {
        this(inspector, discovery, TracingService.getInstance().getTracer());
    }

    // ========================================================================
    // SINGLE WINDOW
    // ========================================================================

    @Override
    public boolean matches(IWindowMatch match, WindowHandle handle) {
        Objects.requireNonNull(match, "match cannot be null");
        return match.match(inspector.snapshot(Objects.requireNonNull(handle, "handle cannot be null")));
    }

    @Override
    public boolean isActive(IWindowMatch match) {
        Objects.requireNonNull(match, "match cannot be null");
        return match.match(inspector.activeWindowSnapshot());
    }

    @Override
    public List<WindowHandle> findAll(IWindowMatch match, DiscoveryMode mode) {
        Objects.requireNonNull(match, "match cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        return List.copyOf(discovery.discover(match, mode));
    }

    public List<WindowHandle> findAll(IWindowMatch match) {
        return findAll(match, defaultMode);
    }

    // ========================================================================
    // ENUMERATION
    // ========================================================================

    @Override
    public void forEach(IWindowMatch match, Consumer<WindowHandle> action, DiscoveryMode mode) {
        Objects.requireNonNull(action, "action cannot be null");
        forAll(match, handle -> {
            action.accept(handle);
            return true;
        }, mode);
    }

    public void forEach(IWindowMatch match, Consumer<WindowHandle> action) {
        forEach(match, action, defaultMode);
    }

    @Override
    public boolean forAll(IWindowMatch match, Predicate<WindowHandle> action, DiscoveryMode mode) {
        Objects.requireNonNull(action, "action cannot be null");
        Span span = startSpan(mode);
        try (Scope scope = span.makeCurrent()) {
            List<WindowHandle> windows = discover(match, mode, span);

            int visited = 0;
            boolean completed = true;
            for (WindowHandle window : windows) {
                visited++;
                if (!action.test(window)) {
                    completed = false;
                    break;
                }
            }

            finish(span, windows.size(), visited, completed);
            return completed;
        } catch (RuntimeException e) {
            fail(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    public boolean forAll(IWindowMatch match, Predicate<WindowHandle> action) {
        return forAll(match, action, defaultMode);
    }

    @Override
    public CompletableFuture<Boolean> forAllAsync(IWindowMatch match,
                                                  Function<WindowHandle, ? extends CompletionStage<Boolean>> action,
                                                  DiscoveryMode mode) {
        Objects.requireNonNull(action, "action cannot be null");
        Span span = startSpan(mode);
        List<WindowHandle> discovered;
        try (Scope scope = span.makeCurrent()) {
            discovered = discover(match, mode, span);
        } catch (RuntimeException e) {
            fail(span, e);
            span.end();
            return CompletableFuture.failedFuture(e);
        }

        final List<WindowHandle> windows = discovered;
        int[] visited = {0};
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        visitFrom(windows, 0, action, visited, result);
        return result.whenComplete((completed, error) -> {
            if (error != null) {
                fail(span, error);
            } else {
                finish(span, windows.size(), visited[0], completed);
            }
            span.end();
        });
    }

    public CompletableFuture<Boolean> forAllAsync(IWindowMatch match,
                                                  Function<WindowHandle, ? extends CompletionStage<Boolean>> action) {
        return forAllAsync(match, action, defaultMode);
    }

    /**
     * Visits {@code windows} from {@code index} on, completing {@code result}
     * when the visit stops or fails. Stages that are already complete are
     * consumed in a loop; only a pending stage suspends the visit, which then
     * resumes from that stage's completion. The stack depth therefore never
     * grows with the number of windows, and at most one action is in flight.
     */
    private void visitFrom(List<WindowHandle> windows, int index,
                           Function<WindowHandle, ? extends CompletionStage<Boolean>> action,
                           int[] visited, CompletableFuture<Boolean> result) {
        for (int i = index; i < windows.size(); i++) {
            CompletableFuture<Boolean> stage;
            try {
                visited[0]++;
                WindowHandle window = windows.get(i);
                stage = Objects.requireNonNull(action.apply(window),
                        "action returned a null stage for window " + window).toCompletableFuture();
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }

            if (!stage.isDone()) {
                // Whoever flips the flag first owns the continuation: the callback
                // if the stage completes later, this loop if it completed meanwhile
                AtomicBoolean pending = new AtomicBoolean(true);
                int next = i + 1;
                stage.whenComplete((keepGoing, error) -> {
                    if (pending.compareAndSet(true, false)) {
                        return;
                    }
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else if (Boolean.TRUE.equals(keepGoing)) {
                        visitFrom(windows, next, action, visited, result);
                    } else {
                        result.complete(false);
                    }
                });
                if (pending.compareAndSet(true, false)) {
                    return;
                }
            }

            Boolean keepGoing;
            try {
                keepGoing = stage.join();
            } catch (CompletionException e) {
                result.completeExceptionally(e.getCause() != null ? e.getCause() : e);
                return;
            } catch (CancellationException e) {
                result.completeExceptionally(e);
                return;
            }
            if (!Boolean.TRUE.equals(keepGoing)) {
                result.complete(false);
                return;
            }
        }
        result.complete(true);
    }

    // ========================================================================
    // TRACING
    // ========================================================================

    private List<WindowHandle> discover(IWindowMatch match, DiscoveryMode mode, Span span) {
        Objects.requireNonNull(match, "match cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        List<WindowHandle> windows = discovery.discover(match, mode);
        span.setAttribute("windowsDiscovered", windows.size());
        return windows;
    }

    private Span startSpan(DiscoveryMode mode) {
        Span span = tracer.spanBuilder("enumerate-windows").startSpan();
        span.setAttribute("discoveryMode", String.valueOf(mode));
        return span;
    }

    private void finish(Span span, int discovered, int visited, boolean completed) {
        span.setAttribute("windowsVisited", visited);
        span.setAttribute("completed", completed);
        logger.fine(String.format("Enumerated %d/%d windows, completed=%b", visited, discovered, completed));
    }

    private void fail(Span span, Throwable error) {
        span.recordException(error);
        span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
    }
}
