package com.acme.interop.bridge.transport;

import com.acme.interop.bridge.call.CallOutcome;
import com.acme.interop.bridge.call.ForeignTransport;
import com.acme.interop.bridge.call.HostEndpoint;
import com.acme.interop.bridge.call.PendingCall;
import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.ErrorMarshaller;
import com.acme.interop.bridge.error.FailureKind;
import com.acme.interop.bridge.handle.Handle;
import com.acme.interop.bridge.handle.ReleaseResult;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process transport to a peer {@link HostEndpoint}.
 *
 * <p>In {@link Mode#EXECUTOR} mode a top-level call runs on one of the peer's executors, picked
 * by target handle so calls on one handle keep their order. A call made by a thread that is
 * already delivering a loopback call runs inline instead, the way a native call stack nests, so
 * callback chains cannot deadlock on a busy executor. {@link Mode#INLINE} always runs on the
 * caller's thread, the way a foreign thread calls straight into the host.</p>
 */
public final class LoopbackTransport implements ForeignTransport {
    private static final Logger LOG = Logger.getLogger(LoopbackTransport.class.getName());

    public enum Mode {
        EXECUTOR,
        INLINE
    }

    private final String name;
    private final LoopbackLink link;
    private final Mode mode;
    private final EventExecutor[] executors;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile HostEndpoint peer;

    public LoopbackTransport(String name, LoopbackLink link, Mode mode, EventExecutorGroup executorGroup) {
        this.name = Objects.requireNonNull(name, "name");
        this.link = Objects.requireNonNull(link, "link");
        this.mode = Objects.requireNonNull(mode, "mode");
        if (mode == Mode.EXECUTOR) {
            List<EventExecutor> all = new ArrayList<>();
            Objects.requireNonNull(executorGroup, "executorGroup").forEach(all::add);
            if (all.isEmpty()) {
                throw new IllegalArgumentException("executorGroup has no executors");
            }
            this.executors = all.toArray(new EventExecutor[0]);
        } else {
            this.executors = new EventExecutor[0];
        }
    }

    public void connect(HostEndpoint peer) {
        this.peer = Objects.requireNonNull(peer, "peer");
    }

    @Override
    public void send(PendingCall call) {
        HostEndpoint target = requirePeer();
        if (mode == Mode.INLINE || link.inDelivery()) {
            deliver(target, call);
            return;
        }
        EventExecutor executor = executors[executorIndex(call.targetHandle())];
        try {
            executor.execute(() -> deliver(target, call));
        } catch (RejectedExecutionException e) {
            throw new BridgeException(FailureKind.TRANSPORT, "Transport " + name + " rejected " + call, e);
        }
    }

    @Override
    public ReleaseResult release(long foreignHandle) {
        HostEndpoint target = peer;
        if (target == null) {
            LOG.fine(() -> "Transport " + name + " not connected, dropping release of " + Handle.fromRaw(foreignHandle));
            return ReleaseResult.STALE;
        }
        return target.release(foreignHandle);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.fine("Loopback transport " + name + " closed");
        }
    }

    private HostEndpoint requirePeer() {
        if (closed.get()) {
            throw new BridgeException(FailureKind.TRANSPORT, "Transport " + name + " is closed");
        }
        HostEndpoint target = peer;
        if (target == null) {
            throw new BridgeException(FailureKind.TRANSPORT, "Transport " + name + " is not connected");
        }
        return target;
    }

    private void deliver(HostEndpoint target, PendingCall call) {
        link.enter();
        try {
            call.complete(target.invokeHost(call.targetHandle(), call.selector(), call.args()));
        } catch (Throwable t) {
            // an Error escaping the endpoint is a host fault; anything else is the link failing
            FailureKind kind = t instanceof Error ? FailureKind.HOST_FAULT : FailureKind.TRANSPORT;
            LOG.log(Level.WARNING, "Loopback delivery failed for " + call, t);
            call.complete(CallOutcome.failed(kind, ErrorMarshaller.INSTANCE.toForeign(t)));
        } finally {
            link.exit();
        }
    }

    private int executorIndex(long rawHandle) {
        int h = Long.hashCode(rawHandle);
        h ^= (h >>> 16);
        return Math.floorMod(h, executors.length);
    }
}
