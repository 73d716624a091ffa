package com.acme.interop.bridge.call;

import com.acme.interop.bridge.catalog.Capability;
import com.acme.interop.bridge.catalog.CapabilityCatalog;
import com.acme.interop.bridge.catalog.MethodSignature;
import com.acme.interop.bridge.catalog.NoSuchSelectorException;
import com.acme.interop.bridge.catalog.Selector;
import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.ErrorMarshaller;
import com.acme.interop.bridge.error.FailureKind;
import com.acme.interop.bridge.error.ForeignError;
import com.acme.interop.bridge.error.ForeignException;
import com.acme.interop.bridge.handle.StaleHandleException;
import com.acme.interop.bridge.proxy.ReferenceBridge;
import com.acme.interop.bridge.telemetry.BridgeMetrics;
import com.acme.interop.bridge.wire.MarshallingException;
import com.acme.interop.bridge.wire.WireValue;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs calls in both directions.
 *
 * <p>{@link #invokeForeign} blocks the calling thread until the transport completes the call and
 * turns failures into {@link BridgeException}s. {@link #invokeHost} is what the other side calls:
 * it attaches the thread, resolves and checks the target, runs the bound stub and returns every
 * failure as a {@link CallOutcome.Failed} value.</p>
 *
 * <p>Both directions are tracked as {@link PendingCall}s while they run.</p>
 */
public final class CallbackDispatcher {
    private static final Logger LOG = Logger.getLogger(CallbackDispatcher.class.getName());

    private final CapabilityCatalog catalog;
    private final ReferenceBridge references;
    private final ForeignTransport transport;
    private final HostThreadRegistry threads;
    private final BridgeMetrics metrics;
    private final Duration defaultTimeout;
    private final Set<PendingCall> inFlight = ConcurrentHashMap.newKeySet();

    public CallbackDispatcher(CapabilityCatalog catalog,
                              ReferenceBridge references,
                              ForeignTransport transport,
                              HostThreadRegistry threads,
                              BridgeMetrics metrics,
                              Duration defaultTimeout) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.references = Objects.requireNonNull(references, "references");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.threads = Objects.requireNonNull(threads, "threads");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.defaultTimeout = defaultTimeout == null ? Duration.ZERO : defaultTimeout;
    }

    public WireValue invokeForeign(long foreignHandle, Selector selector, List<WireValue> args) {
        return invokeForeign(foreignHandle, selector, args, defaultTimeout);
    }

    /**
     * Calls a method of a foreign object and waits for its result.
     *
     * @param timeout bounded wait; {@code null} or zero waits until the call completes
     * @throws StaleHandleException if the foreign handle is stale
     * @throws NoSuchSelectorException if the foreign object cannot dispatch the selector
     * @throws ForeignException if the foreign method reported an error or faulted
     * @throws CallTimeoutException if the bounded wait expired
     */
    public WireValue invokeForeign(long foreignHandle, Selector selector, List<WireValue> args, Duration timeout) {
        PendingCall call = new PendingCall(CallDirection.HOST_TO_FOREIGN, foreignHandle, selector, args, this::discardLate);
        metrics.incOutboundCalls(1);
        long startNanos = System.nanoTime();
        call.markSent();
        inFlight.add(call);
        CallOutcome outcome;
        try {
            try {
                transport.send(call);
            } catch (RuntimeException e) {
                LOG.log(Level.FINE, "Transport refused " + call, e);
                FailureKind kind = e instanceof BridgeException bridge ? bridge.kind() : FailureKind.TRANSPORT;
                if (call.complete(CallOutcome.failed(kind, ErrorMarshaller.INSTANCE.toForeign(e)))) {
                    references.discardOutgoing(call.args());
                }
            }
            outcome = call.await(timeout);
        } finally {
            inFlight.remove(call);
        }
        metrics.observeCallNanos(System.nanoTime() - startNanos);
        if (outcome instanceof CallOutcome.Returned returned) {
            return returned.value();
        }
        CallOutcome.Failed failed = (CallOutcome.Failed) outcome;
        metrics.incFailures(1, failed.kind());
        throw toException(call, failed);
    }

    /**
     * Entry point for calls from the other side. Never throws.
     */
    public CallOutcome invokeHost(long handle, Selector selector, List<WireValue> args) {
        metrics.incInboundCalls(1);
        PendingCall call;
        try {
            call = new PendingCall(CallDirection.FOREIGN_TO_HOST, handle, selector, args);
        } catch (NullPointerException e) {
            return failure(handle, selector, new MarshallingException("Missing selector or argument in call on " + handle));
        }
        call.markSent();
        inFlight.add(call);
        try {
            CallOutcome outcome = runInbound(handle, selector, args);
            call.complete(outcome);
            return outcome;
        } finally {
            inFlight.remove(call);
        }
    }

    /** Calls currently running through this dispatcher, in either direction. */
    public List<PendingCall> inFlight() {
        return List.copyOf(inFlight);
    }

    private CallOutcome runInbound(long handle, Selector selector, List<WireValue> args) {
        HostThreadRegistry.ThreadScope scope;
        try {
            scope = threads.enter();
        } catch (BridgeException e) {
            references.discardIncoming(args);
            return failure(handle, selector, e);
        }
        try (scope) {
            return dispatch(handle, selector, args);
        } catch (BridgeException e) {
            return failure(handle, selector, e);
        } catch (Throwable t) {
            metrics.incFailures(1, FailureKind.HOST_FAULT);
            LOG.log(Level.WARNING, "Unexpected failure dispatching " + selector, t);
            return CallOutcome.failed(FailureKind.HOST_FAULT, ErrorMarshaller.INSTANCE.toForeign(t));
        }
    }

    private CallOutcome failure(long handle, Selector selector, BridgeException e) {
        metrics.incFailures(1, e.kind());
        LOG.fine(() -> "Call " + selector + " on " + handle + " failed: " + e.kind() + " " + e.getMessage());
        return CallOutcome.failed(e.kind(), ErrorMarshaller.INSTANCE.toForeign(e));
    }

    private CallOutcome dispatch(long handle, Selector selector, List<WireValue> args) {
        ReferenceBridge.Exposure target;
        Capability<?> capability;
        MethodSignature signature;
        try {
            target = references.exposure(handle);
            capability = catalog.require(selector.capability());
            if (!target.exposedAs(capability.name())) {
                throw new NoSuchSelectorException("Object " + target.handle() + " was not exposed as " + capability.name());
            }
            signature = capability.resolve(selector);
            if (args.size() != signature.arity()) {
                throw new NoSuchSelectorException(selector + " takes " + signature.arity() + " arguments, got " + args.size());
            }
        } catch (BridgeException e) {
            references.discardIncoming(args);
            throw e;
        }
        Object[] decoded = references.decodeAll(signature.params(), args);

        Object result;
        try {
            result = capability.serialized()
                ? invokeSerialized(capability, target.object(), signature, decoded)
                : capability.invoke(target.object(), signature, decoded);
        } catch (Exception e) {
            if (signature.fallible()) {
                metrics.incFailures(1, FailureKind.DOMAIN);
                return CallOutcome.failed(FailureKind.DOMAIN, ErrorMarshaller.INSTANCE.toForeign(e));
            }
            metrics.incFailures(1, FailureKind.HOST_FAULT);
            LOG.log(Level.WARNING, "Host method " + capability.name() + "." + signature.name() + " failed", e);
            return CallOutcome.failed(FailureKind.HOST_FAULT, ErrorMarshaller.INSTANCE.toForeign(e));
        } catch (Error e) {
            metrics.incFailures(1, FailureKind.HOST_FAULT);
            LOG.log(Level.SEVERE, "Host method " + capability.name() + "." + signature.name() + " faulted", e);
            return CallOutcome.failed(FailureKind.HOST_FAULT, ErrorMarshaller.INSTANCE.toForeign(e));
        }
        return CallOutcome.returned(references.encode(signature.result(), result));
    }

    private static Object invokeSerialized(Capability<?> capability, Object target, MethodSignature signature, Object[] args)
        throws Exception {
        synchronized (target) {
            return capability.invoke(target, signature, args);
        }
    }

    private void discardLate(CallOutcome outcome) {
        if (outcome instanceof CallOutcome.Returned returned) {
            references.discardIncoming(List.of(returned.value()));
        }
    }

    private static BridgeException toException(PendingCall call, CallOutcome.Failed failed) {
        ForeignError error = failed.error();
        return switch (failed.kind()) {
            case STALE_HANDLE -> new StaleHandleException(call.targetHandle(), error.message());
            case NO_SUCH_METHOD -> new NoSuchSelectorException(error.message());
            case TIMEOUT -> new CallTimeoutException(call.id(), error.message());
            case INTERRUPTED -> new BridgeException(FailureKind.INTERRUPTED, error.message());
            case DOMAIN -> ErrorMarshaller.INSTANCE.toHost(error);
            default -> ErrorMarshaller.INSTANCE.toHost(failed.kind(), error);
        };
    }
}
