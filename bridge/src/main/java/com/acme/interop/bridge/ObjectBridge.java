package com.acme.interop.bridge;

import com.acme.interop.bridge.call.CallOutcome;
import com.acme.interop.bridge.call.CallbackDispatcher;
import com.acme.interop.bridge.call.ForeignTransport;
import com.acme.interop.bridge.call.HostEndpoint;
import com.acme.interop.bridge.call.HostThreadRegistry;
import com.acme.interop.bridge.call.PendingCall;
import com.acme.interop.bridge.catalog.Capability;
import com.acme.interop.bridge.catalog.CapabilityCatalog;
import com.acme.interop.bridge.catalog.MethodSignature;
import com.acme.interop.bridge.catalog.Selector;
import com.acme.interop.bridge.catalog.TypeRef;
import com.acme.interop.bridge.handle.Handle;
import com.acme.interop.bridge.handle.HandleTable;
import com.acme.interop.bridge.handle.HandleTableStats;
import com.acme.interop.bridge.handle.ReleaseResult;
import com.acme.interop.bridge.lifecycle.LifecycleMonitor;
import com.acme.interop.bridge.proxy.ReferenceBridge;
import com.acme.interop.bridge.telemetry.AtomicBridgeMetrics;
import com.acme.interop.bridge.telemetry.BridgeMetrics;
import com.acme.interop.bridge.telemetry.PeriodicMetricsReporter;
import com.acme.interop.bridge.wire.Side;
import com.acme.interop.bridge.wire.WireValue;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One side of the object bridge: its handle table, proxies, dispatcher and lifecycle monitor.
 *
 * <p>Host code uses {@link #exposeToForeign}, {@link #wrapForeignAsProxy}, {@link #invokeForeign}
 * and {@link #drainSignals}. The other side calls only {@link #invokeHost} and {@link #release}.
 * {@link #close()} shuts down in a fixed order: refuse new foreign entries, flush pending
 * collection signals, close the transport, free every handle.</p>
 */
public final class ObjectBridge implements HostEndpoint, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ObjectBridge.class.getName());

    private final Side side;
    private final CapabilityCatalog catalog;
    private final ForeignTransport transport;
    private final BridgeMetrics metrics;
    private final HandleTable table;
    private final LifecycleMonitor lifecycle;
    private final ReferenceBridge references;
    private final HostThreadRegistry threads;
    private final CallbackDispatcher dispatcher;
    private final PeriodicMetricsReporter reporter;
    private final AtomicBoolean closed = new AtomicBoolean();

    public ObjectBridge(BridgeConfig config,
                        Side side,
                        CapabilityCatalog catalog,
                        ForeignTransport transport,
                        BridgeMetrics metrics) {
        Objects.requireNonNull(config, "config");
        if (Objects.requireNonNull(side, "side") == Side.NONE) {
            throw new IllegalArgumentException("side must be HOST or FOREIGN");
        }
        this.side = side;
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.metrics = Objects.requireNonNull(metrics, "metrics");

        String name = side.name().toLowerCase(Locale.ROOT);
        ReferenceBridge[] referencesRef = new ReferenceBridge[1];
        this.table = new HandleTable(config.handleCapacity(), config.handleStripes(), (handle, object) -> {
            ReferenceBridge refs = referencesRef[0];
            if (refs != null) {
                refs.onSlotFreed(handle, object);
                metrics.setLiveHandles(refs.exposedObjects());
            }
        });
        this.lifecycle = new LifecycleMonitor(name, config.signalQueueCapacity(), config.signalOverflow(), transport, metrics);
        this.references = new ReferenceBridge(side, table, catalog, lifecycle, transport);
        referencesRef[0] = references;
        this.threads = new HostThreadRegistry(name, metrics);
        this.dispatcher = new CallbackDispatcher(catalog, references, transport, threads, metrics, config.callTimeout());
        references.connect(dispatcher);

        if (config.metricsLogIntervalSec() > 0 && metrics instanceof AtomicBridgeMetrics atomic) {
            this.reporter = new PeriodicMetricsReporter(atomic, side.name(), config.metricsLogIntervalSec(),
                () -> Map.of(
                    "pendingSignals", (long) lifecycle.pendingSignals(),
                    "liveProxies", (long) references.liveProxies(),
                    "attachedThreads", (long) threads.attachedThreads()));
            this.reporter.start();
        } else {
            this.reporter = null;
        }
        LOG.info("Object bridge started side=" + side + " capabilities=" + catalog.size()
            + " handleCapacity=" + table.capacity() + " stripes=" + table.stripeCount()
            + " signalQueue=" + config.signalQueueCapacity() + " overflow=" + config.signalOverflow());
    }

    public Side side() {
        return side;
    }

    public CapabilityCatalog catalog() {
        return catalog;
    }

    // ---- host entry points ----

    public Handle exposeToForeign(Object object, Capability<?>... capabilities) {
        Handle handle = references.exposeToForeign(object, capabilities);
        metrics.setLiveHandles(references.exposedObjects());
        return handle;
    }

    public Handle exposeToForeign(Object object, String... capabilityNames) {
        Capability<?>[] capabilities = new Capability<?>[capabilityNames.length];
        for (int i = 0; i < capabilityNames.length; i++) {
            capabilities[i] = catalog.require(capabilityNames[i]);
        }
        return exposeToForeign(object, capabilities);
    }

    /**
     * Wraps a handle owned by the other side. The proxy takes over one reference to it.
     */
    public <T> T wrapForeignAsProxy(long foreignHandle, Class<T> capabilityType) {
        return references.wrapForeignAsProxy(foreignHandle, catalog.forType(capabilityType));
    }

    public <T> T wrapForeignAsProxy(long foreignHandle, Capability<T> capability) {
        return references.wrapForeignAsProxy(foreignHandle, capability);
    }

    /**
     * Wire-level call of a foreign method.
     */
    public WireValue invokeForeign(long foreignHandle, Selector selector, List<WireValue> args) {
        return dispatcher.invokeForeign(foreignHandle, selector, args);
    }

    public WireValue invokeForeign(long foreignHandle, Selector selector, List<WireValue> args, Duration timeout) {
        return dispatcher.invokeForeign(foreignHandle, selector, args, timeout);
    }

    /**
     * Object-level call of a foreign method: arguments and result are marshalled per the
     * catalogue signature.
     */
    public Object invokeForeign(long foreignHandle, String capability, String method, Object... args) {
        MethodSignature signature = catalog.require(capability).method(method);
        List<WireValue> wireArgs = references.encodeAll(signature.params(), args);
        WireValue result = dispatcher.invokeForeign(foreignHandle, Selector.of(capability, signature), wireArgs);
        return references.decode(signature.result(), result);
    }

    public WireValue encode(TypeRef type, Object value) {
        return references.encode(type, value);
    }

    public Object decode(TypeRef type, WireValue value) {
        return references.decode(type, value);
    }

    /**
     * Delivers up to {@code max} pending collection signals, giving each reference back to the
     * other side. Returns however many arrived before {@code timeout}.
     */
    public int drainSignals(int max, Duration timeout) {
        return lifecycle.drainSignals(max, timeout);
    }

    /**
     * Gives a proxy's reference back without waiting for collection. Later calls through the
     * proxy fail as stale.
     */
    public boolean releaseProxy(Object proxy) {
        return references.releaseProxy(proxy);
    }

    public boolean isProxy(Object object) {
        return references.isProxy(object);
    }

    // ---- foreign entry points ----

    @Override
    public CallOutcome invokeHost(long handle, Selector selector, List<WireValue> args) {
        return dispatcher.invokeHost(handle, selector, args);
    }

    @Override
    public ReleaseResult release(long handle) {
        return table.release(handle);
    }

    // ---- introspection ----

    public HandleTableStats handleStats() {
        return table.stats();
    }

    public int liveHandles() {
        return table.liveCount();
    }

    public boolean isLive(long rawHandle) {
        return table.isLive(Handle.fromRaw(rawHandle));
    }

    public int refCount(long rawHandle) {
        return table.refCount(Handle.fromRaw(rawHandle));
    }

    public int liveProxies() {
        return references.liveProxies();
    }

    public int pendingSignals() {
        return lifecycle.pendingSignals();
    }

    public long droppedSignals() {
        return lifecycle.droppedSignals();
    }

    public int attachedThreads() {
        return threads.attachedThreads();
    }

    public List<PendingCall> inFlightCalls() {
        return dispatcher.inFlight();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        threads.close();
        lifecycle.close();
        try {
            transport.close();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Transport close failed for side " + side, e);
        }
        int cleared = table.clear();
        if (reporter != null) {
            reporter.close();
        }
        LOG.info("Object bridge stopped side=" + side + " clearedHandles=" + cleared);
    }
}
