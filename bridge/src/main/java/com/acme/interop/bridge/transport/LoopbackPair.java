package com.acme.interop.bridge.transport;

import com.acme.interop.bridge.BridgeConfig;
import com.acme.interop.bridge.ObjectBridge;
import com.acme.interop.bridge.catalog.Capability;
import com.acme.interop.bridge.catalog.CapabilityCatalog;
import com.acme.interop.bridge.handle.Handle;
import com.acme.interop.bridge.telemetry.BridgeMetrics;
import com.acme.interop.bridge.telemetry.NoopBridgeMetrics;
import com.acme.interop.bridge.util.BridgeDefaults;
import com.acme.interop.bridge.wire.Side;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * A {@code HOST} and a {@code FOREIGN} bridge wired back to back in one process.
 *
 * <p>Host-to-foreign calls run on the foreign side's executor threads. Foreign-to-host calls run
 * on the calling foreign thread, which the host side attaches on first use.</p>
 */
public final class LoopbackPair implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LoopbackPair.class.getName());

    private final EventExecutorGroup foreignThreads;
    private final ObjectBridge host;
    private final ObjectBridge foreign;

    private LoopbackPair(EventExecutorGroup foreignThreads, ObjectBridge host, ObjectBridge foreign) {
        this.foreignThreads = foreignThreads;
        this.host = host;
        this.foreign = foreign;
    }

    public static LoopbackPair create(BridgeConfig config, CapabilityCatalog catalog) {
        return create(config, catalog, NoopBridgeMetrics.INSTANCE, NoopBridgeMetrics.INSTANCE);
    }

    public static LoopbackPair create(BridgeConfig config,
                                      CapabilityCatalog catalog,
                                      BridgeMetrics hostMetrics,
                                      BridgeMetrics foreignMetrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(catalog, "catalog");
        EventExecutorGroup foreignThreads = new DefaultEventExecutorGroup(
            config.foreignThreads(), new DefaultThreadFactory("bridge-foreign", true));
        LoopbackLink link = new LoopbackLink();
        LoopbackTransport hostToForeign = new LoopbackTransport("host->foreign", link, LoopbackTransport.Mode.EXECUTOR, foreignThreads);
        LoopbackTransport foreignToHost = new LoopbackTransport("foreign->host", link, LoopbackTransport.Mode.INLINE, null);
        ObjectBridge host = new ObjectBridge(config, Side.HOST, catalog, hostToForeign, hostMetrics);
        ObjectBridge foreign = new ObjectBridge(config, Side.FOREIGN, catalog, foreignToHost, foreignMetrics);
        hostToForeign.connect(foreign);
        foreignToHost.connect(host);
        return new LoopbackPair(foreignThreads, host, foreign);
    }

    public ObjectBridge host() {
        return host;
    }

    public ObjectBridge foreign() {
        return foreign;
    }

    /**
     * Exposes an object on the foreign side and returns the host's proxy for it.
     */
    public <T> T publishForeign(T foreignObject, Class<T> capabilityType) {
        Capability<T> capability = foreign.catalog().forType(capabilityType);
        Handle handle = foreign.exposeToForeign(foreignObject, capability);
        return host.wrapForeignAsProxy(handle.toRaw(), capability);
    }

    /**
     * Exposes an object on the host side and returns the foreign side's proxy for it.
     */
    public <T> T publishHost(T hostObject, Class<T> capabilityType) {
        Capability<T> capability = host.catalog().forType(capabilityType);
        Handle handle = host.exposeToForeign(hostObject, capability);
        return foreign.wrapForeignAsProxy(handle.toRaw(), capability);
    }

    @Override
    public void close() {
        host.close();
        foreign.close();
        foreignThreads.shutdownGracefully(BridgeDefaults.SHUTDOWN_QUIET_PERIOD_MS, BridgeDefaults.SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
            .awaitUninterruptibly(BridgeDefaults.SHUTDOWN_TIMEOUT_MS);
        LOG.fine("Loopback pair closed");
    }
}
