package com.acme.interop.bridge.call;

import com.acme.interop.bridge.catalog.Selector;
import com.acme.interop.bridge.error.FailureKind;
import com.acme.interop.bridge.wire.WireValue;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One in-flight call. The caller blocks in {@link #await}; the transport calls {@link #complete}
 * from whichever thread ran the call.
 */
public final class PendingCall {
    private static final Logger LOG = Logger.getLogger(PendingCall.class.getName());
    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final CallDirection direction;
    private final long targetHandle;
    private final Selector selector;
    private final List<WireValue> args;
    private final long createdNanos;
    private final Consumer<CallOutcome> onDiscarded;
    private final AtomicReference<CallState> state = new AtomicReference<>(CallState.CREATED);
    private final CompletableFuture<CallOutcome> completion = new CompletableFuture<>();

    public PendingCall(CallDirection direction, long targetHandle, Selector selector, List<WireValue> args) {
        this(direction, targetHandle, selector, args, null);
    }

    /**
     * @param onDiscarded receives a completion that arrived after the waiter gave up, so values it
     *                    carries can be released; may be {@code null}
     */
    public PendingCall(CallDirection direction,
                       long targetHandle,
                       Selector selector,
                       List<WireValue> args,
                       Consumer<CallOutcome> onDiscarded) {
        this.id = IDS.incrementAndGet();
        this.direction = Objects.requireNonNull(direction, "direction");
        this.targetHandle = targetHandle;
        this.selector = Objects.requireNonNull(selector, "selector");
        this.args = List.copyOf(args);
        this.onDiscarded = onDiscarded;
        this.createdNanos = System.nanoTime();
    }

    public long id() {
        return id;
    }

    public CallDirection direction() {
        return direction;
    }

    public long targetHandle() {
        return targetHandle;
    }

    public Selector selector() {
        return selector;
    }

    public List<WireValue> args() {
        return args;
    }

    public long createdNanos() {
        return createdNanos;
    }

    public CallState state() {
        return state.get();
    }

    public void markSent() {
        if (!state.compareAndSet(CallState.CREATED, CallState.SENT)) {
            throw new IllegalStateException("Call " + id + " cannot be sent from state " + state.get());
        }
    }

    /**
     * @return {@code false} if the call was already completed or abandoned; the outcome is then
     *         discarded
     */
    public boolean complete(CallOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        CallState target = outcome instanceof CallOutcome.Returned ? CallState.COMPLETED : CallState.FAILED;
        if (state.compareAndSet(CallState.SENT, target)) {
            completion.complete(outcome);
            return true;
        }
        CallState current = state.get();
        LOG.fine(() -> "Discarding completion of call " + id + " " + selector + " in state " + current);
        if (current == CallState.ABANDONED && onDiscarded != null) {
            try {
                onDiscarded.accept(outcome);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Discard hook failed for call " + id, e);
            }
        }
        return false;
    }

    /**
     * Blocks until the call completes. A {@code null} or non-positive timeout waits without bound.
     * On timeout or interrupt the call is abandoned and a {@code TIMEOUT} or {@code INTERRUPTED}
     * failure is returned, unless it completed in the meantime.
     */
    public CallOutcome await(Duration timeout) {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return completion.get();
            }
            return completion.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (abandon()) {
                return CallOutcome.failed(FailureKind.TIMEOUT, "Call " + selector + " timed out after " + timeout.toMillis() + " ms");
            }
            return completion.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (abandon()) {
                return CallOutcome.failed(FailureKind.INTERRUPTED, "Interrupted while waiting for " + selector);
            }
            return completion.join();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Call " + id + " completed exceptionally", e.getCause());
        }
    }

    private boolean abandon() {
        return state.compareAndSet(CallState.SENT, CallState.ABANDONED)
            || state.compareAndSet(CallState.CREATED, CallState.ABANDONED);
    }

    @Override
    public String toString() {
        return "PendingCall[" + id + " " + direction + " " + selector + " -> " + targetHandle + " " + state.get() + "]";
    }
}
