package com.acme.interop.bridge.proxy;

import com.acme.interop.bridge.call.CallbackDispatcher;
import com.acme.interop.bridge.catalog.Capability;
import com.acme.interop.bridge.catalog.CapabilityCatalog;
import com.acme.interop.bridge.catalog.MethodSignature;
import com.acme.interop.bridge.catalog.NoSuchSelectorException;
import com.acme.interop.bridge.catalog.Selector;
import com.acme.interop.bridge.catalog.TypeRef;
import com.acme.interop.bridge.error.ErrorMarshaller;
import com.acme.interop.bridge.handle.Handle;
import com.acme.interop.bridge.handle.HandleTable;
import com.acme.interop.bridge.handle.ReleaseSink;
import com.acme.interop.bridge.handle.StaleHandleException;
import com.acme.interop.bridge.lifecycle.LifecycleMonitor;
import com.acme.interop.bridge.lifecycle.Watch;
import com.acme.interop.bridge.wire.MarshallingException;
import com.acme.interop.bridge.wire.NullGuard;
import com.acme.interop.bridge.wire.Side;
import com.acme.interop.bridge.wire.WireRef;
import com.acme.interop.bridge.wire.WireValue;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves object references across the boundary in both directions.
 *
 * <p>Outbound, an object of this side is exposed through the handle table. Exposure is keyed by
 * object identity: exposing a live object again reuses its handle and adds a reference. Each
 * reference handed out is owned by exactly one proxy on the other side, which gives it back
 * when it is collected or released.</p>
 *
 * <p>Inbound, a reference owned by the other side becomes a {@link ForeignProxy} that takes over
 * that one reference. Proxies of identity-preserving capabilities are memoized per
 * {@code (handle, capability)}; a repeat arrival hands back the existing proxy and returns the
 * duplicate reference at once. A reference owned by this side resolves to the original object,
 * so an object that goes out and comes back is the same instance.</p>
 */
public final class ReferenceBridge {
    private final Side side;
    private final HandleTable table;
    private final NullGuard nulls;
    private final CapabilityCatalog catalog;
    private final LifecycleMonitor lifecycle;
    private final ReleaseSink foreignRelease;
    private final ConcurrentHashMap<IdentityKey, Exposure> exposures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ProxyKey, WeakReference<Object>> memo = new ConcurrentHashMap<>();
    private final AtomicInteger liveProxies = new AtomicInteger();
    private volatile CallbackDispatcher dispatcher;

    public ReferenceBridge(Side side,
                           HandleTable table,
                           CapabilityCatalog catalog,
                           LifecycleMonitor lifecycle,
                           ReleaseSink foreignRelease) {
        if (Objects.requireNonNull(side, "side") == Side.NONE) {
            throw new IllegalArgumentException("side must be HOST or FOREIGN");
        }
        this.side = side;
        this.table = Objects.requireNonNull(table, "table");
        this.nulls = new NullGuard(side, table);
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.foreignRelease = Objects.requireNonNull(foreignRelease, "foreignRelease");
    }

    public void connect(CallbackDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public Side side() {
        return side;
    }

    // ---- exposure ----

    /**
     * Registers {@code object} (or adds a reference to its existing handle) and records the
     * capabilities it may be called through.
     *
     * @throws IllegalArgumentException if {@code object} is a proxy or does not implement a
     *         capability
     */
    public Handle exposeToForeign(Object object, Capability<?>... capabilities) {
        Objects.requireNonNull(object, "object");
        if (proxyState(object) != null) {
            throw new IllegalArgumentException("Object is a proxy for a foreign object and cannot be exposed again");
        }
        for (Capability<?> capability : capabilities) {
            if (!capability.type().isInstance(object)) {
                throw new IllegalArgumentException(object.getClass().getName() + " does not implement "
                    + capability.type().getName() + " for capability " + capability.name());
            }
        }
        Exposure exposure = exposures.compute(new IdentityKey(object), (key, existing) -> {
            if (existing != null && table.tryRetain(existing.handle)) {
                return existing;
            }
            return new Exposure(table.register(object), object);
        });
        for (Capability<?> capability : capabilities) {
            exposure.capabilities.add(capability.name());
        }
        return exposure.handle;
    }

    /**
     * @throws StaleHandleException if no exposed object has this handle
     */
    public Exposure exposure(long rawHandle) {
        Object object = table.resolve(rawHandle);
        Exposure exposure = exposures.get(new IdentityKey(object));
        if (exposure == null || exposure.handle.toRaw() != rawHandle) {
            throw new StaleHandleException(rawHandle);
        }
        return exposure;
    }

    /** Table callback once a slot is freed. */
    public void onSlotFreed(Handle handle, Object object) {
        exposures.computeIfPresent(new IdentityKey(object), (key, existing) -> existing.handle.equals(handle) ? null : existing);
    }

    public boolean isExposed(Object object) {
        return exposures.containsKey(new IdentityKey(object));
    }

    public int exposedObjects() {
        return exposures.size();
    }

    // ---- proxies ----

    /**
     * Returns a proxy for the foreign object. The proxy takes over one reference to
     * {@code foreignHandle}.
     */
    public <T> T wrapForeignAsProxy(long foreignHandle, Capability<T> capability) {
        Objects.requireNonNull(capability, "capability");
        if (!capability.identityPreserving()) {
            return capability.type().cast(newProxy(foreignHandle, capability, null));
        }
        ProxyKey key = new ProxyKey(foreignHandle, capability.name());
        Object[] found = new Object[1];
        boolean[] created = new boolean[1];
        memo.compute(key, (k, current) -> {
            Object live = current == null ? null : current.get();
            if (live != null && !proxyState(live).isReleased()) {
                found[0] = live;
                return current;
            }
            Object proxy = newProxy(foreignHandle, capability, k);
            WeakReference<Object> fresh = new WeakReference<>(proxy);
            proxyState(proxy).memoRef = fresh;
            found[0] = proxy;
            created[0] = true;
            return fresh;
        });
        if (!created[0]) {
            foreignRelease.release(foreignHandle);
        }
        return capability.type().cast(found[0]);
    }

    /**
     * Gives the proxy's reference back now instead of waiting for collection.
     *
     * @return {@code false} if it was already given back
     */
    public boolean releaseProxy(Object proxy) {
        ProxyState state = proxyState(proxy);
        if (state == null) {
            throw new IllegalArgumentException("Not a foreign proxy of this bridge: " + proxy);
        }
        return state.release();
    }

    public boolean isProxy(Object object) {
        return proxyState(object) != null;
    }

    public int liveProxies() {
        return liveProxies.get();
    }

    private Object newProxy(long foreignHandle, Capability<?> capability, ProxyKey memoKey) {
        ProxyState state = new ProxyState(capability, foreignHandle, memoKey);
        Object proxy = Proxy.newProxyInstance(
            capability.type().getClassLoader(),
            new Class<?>[]{capability.type(), ForeignProxy.class},
            state);
        state.watch = lifecycle.onExposed(foreignHandle, proxy, state::onFired);
        liveProxies.incrementAndGet();
        return proxy;
    }

    private ProxyState proxyState(Object object) {
        if (object == null || !Proxy.isProxyClass(object.getClass())) {
            return null;
        }
        InvocationHandler handler = Proxy.getInvocationHandler(object);
        if (handler instanceof ProxyState state && state.owner() == this) {
            return state;
        }
        return null;
    }

    // ---- marshalling ----

    public List<WireValue> encodeAll(List<TypeRef> types, Object[] values) {
        int count = values == null ? 0 : values.length;
        if (count != types.size()) {
            throw new MarshallingException("Expected " + types.size() + " arguments, got " + count);
        }
        List<WireValue> encoded = new ArrayList<>(count);
        try {
            for (int i = 0; i < count; i++) {
                encoded.add(encode(types.get(i), values[i]));
            }
        } catch (RuntimeException e) {
            discardOutgoing(encoded);
            throw e;
        }
        return encoded;
    }

    /**
     * Decodes arguments. On failure every reference not yet taken over is given back.
     */
    public Object[] decodeAll(List<TypeRef> types, List<WireValue> values) {
        if (values.size() != types.size()) {
            discardIncoming(values);
            throw new MarshallingException("Expected " + types.size() + " arguments, got " + values.size());
        }
        Object[] decoded = new Object[values.size()];
        for (int i = 0; i < decoded.length; i++) {
            try {
                decoded[i] = decode(types.get(i), values.get(i));
            } catch (RuntimeException e) {
                discardIncoming(values.subList(i + 1, values.size()));
                throw e;
            }
        }
        return decoded;
    }

    public WireValue encode(TypeRef type, Object value) {
        switch (type.type()) {
            case UNIT:
                return WireValue.UNIT;
            case BOOL:
                if (value instanceof Boolean b) {
                    return new WireValue.Bool(b);
                }
                break;
            case INT32:
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return new WireValue.Int32(((Number) value).intValue());
                }
                break;
            case INT64:
                if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return new WireValue.Int64(((Number) value).longValue());
                }
                break;
            case FLOAT32:
                if (value instanceof Float f) {
                    return new WireValue.Float32(f);
                }
                break;
            case FLOAT64:
                if (value instanceof Double || value instanceof Float) {
                    return new WireValue.Float64(((Number) value).doubleValue());
                }
                break;
            case STRING:
                if (value instanceof String s) {
                    return new WireValue.Str(s);
                }
                break;
            case BYTES:
                if (value == null || value instanceof byte[]) {
                    return new WireValue.Bytes((byte[]) value);
                }
                break;
            case ERROR:
                if (value == null || value instanceof Throwable) {
                    return new WireValue.Err(ErrorMarshaller.INSTANCE.toForeign((Throwable) value));
                }
                break;
            case REF:
                return new WireValue.Ref(encodeRef(type, value));
        }
        throw new MarshallingException("Cannot encode " + describe(value) + " as " + type);
    }

    public Object decode(TypeRef type, WireValue value) {
        Objects.requireNonNull(value, "value");
        if (value.type() != type.type()) {
            discardIncoming(List.of(value));
            throw new MarshallingException("Expected " + type + ", got " + value.type());
        }
        if (value instanceof WireValue.Unit) {
            return null;
        } else if (value instanceof WireValue.Bool v) {
            return v.value();
        } else if (value instanceof WireValue.Int32 v) {
            return v.value();
        } else if (value instanceof WireValue.Int64 v) {
            return v.value();
        } else if (value instanceof WireValue.Float32 v) {
            return v.value();
        } else if (value instanceof WireValue.Float64 v) {
            return v.value();
        } else if (value instanceof WireValue.Str v) {
            return v.value();
        } else if (value instanceof WireValue.Bytes v) {
            return v.value();
        } else if (value instanceof WireValue.Err v) {
            return ErrorMarshaller.INSTANCE.toHost(v.error());
        } else if (value instanceof WireValue.Ref v) {
            return decodeRef(type, v.ref());
        }
        throw new MarshallingException("Unsupported wire value " + value);
    }

    /** Gives back references this side handed out in values the other side never took over. */
    public void discardOutgoing(List<WireValue> values) {
        for (WireValue value : values) {
            if (value instanceof WireValue.Ref ref && ref.ref().owner() == side) {
                table.release(ref.ref().raw());
            }
        }
    }

    /** Gives back references the other side handed to us in values this side will not decode. */
    public void discardIncoming(List<WireValue> values) {
        for (WireValue value : values) {
            if (value instanceof WireValue.Ref ref && ref.ref().owner() == side.peer()) {
                foreignRelease.release(ref.ref().raw());
            }
        }
    }

    private WireRef encodeRef(TypeRef type, Object value) {
        return nulls.encode(value, live -> encodeLiveRef(type, live));
    }

    private WireRef encodeLiveRef(TypeRef type, Object value) {
        ProxyState state = proxyState(value);
        if (state != null) {
            if (state.isReleased()) {
                throw new StaleHandleException(state.foreignHandle, "Proxy for " + Handle.fromRaw(state.foreignHandle) + " was released");
            }
            return WireRef.of(side.peer(), state.foreignHandle);
        }
        Capability<?> capability = catalog.require(type.capability());
        if (!capability.type().isInstance(value)) {
            throw new MarshallingException(describe(value) + " does not implement " + capability.type().getName());
        }
        return nulls.owned(exposeToForeign(value, capability));
    }

    private Object decodeRef(TypeRef type, WireRef ref) {
        return nulls.decode(ref, live -> decodeLiveRef(type, live));
    }

    private Object decodeLiveRef(TypeRef type, WireRef ref) {
        Capability<?> capability;
        try {
            capability = catalog.require(type.capability());
        } catch (NoSuchSelectorException e) {
            discardIncoming(List.of(new WireValue.Ref(ref)));
            throw e;
        }
        if (ref.owner() == side) {
            Object object = nulls.resolveOwned(ref);
            if (!capability.type().isInstance(object)) {
                throw new MarshallingException(describe(object) + " does not implement " + capability.type().getName());
            }
            return object;
        }
        return wrapForeignAsProxy(ref.raw(), capability);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    // ---- forwarding ----

    Object forward(ProxyState state, Object proxy, MethodSignature signature, Object[] args) {
        CallbackDispatcher target = dispatcher;
        if (target == null) {
            throw new IllegalStateException("ReferenceBridge is not connected to a dispatcher");
        }
        try {
            List<WireValue> wireArgs = encodeAll(signature.params(), args);
            WireValue result = target.invokeForeign(state.foreignHandle, Selector.of(state.capability.name(), signature), wireArgs);
            return decode(signature.result(), result);
        } finally {
            Reference.reachabilityFence(proxy);
            Reference.reachabilityFence(args);
        }
    }

    /**
     * An exposed object with the capabilities it was exposed through.
     */
    public static final class Exposure {
        private final Handle handle;
        private final Object object;
        private final Set<String> capabilities = ConcurrentHashMap.newKeySet();

        private Exposure(Handle handle, Object object) {
            this.handle = handle;
            this.object = object;
        }

        public Handle handle() {
            return handle;
        }

        public Object object() {
            return object;
        }

        public Set<String> capabilities() {
            return Collections.unmodifiableSet(capabilities);
        }

        public boolean exposedAs(String capability) {
            return capabilities.contains(capability);
        }
    }

    private record ProxyKey(long foreignHandle, String capability) {}

    private static final class IdentityKey {
        private final Object object;

        private IdentityKey(Object object) {
            this.object = object;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IdentityKey other && other.object == object;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(object);
        }
    }

    /**
     * Invocation handler of one proxy. Owns one reference to {@code foreignHandle}.
     */
    final class ProxyState implements InvocationHandler {
        private final Capability<?> capability;
        private final long foreignHandle;
        private final ProxyKey memoKey;
        private final AtomicBoolean released = new AtomicBoolean();
        private volatile Watch watch;
        private volatile WeakReference<Object> memoRef;

        ProxyState(Capability<?> capability, long foreignHandle, ProxyKey memoKey) {
            this.capability = capability;
            this.foreignHandle = foreignHandle;
            this.memoKey = memoKey;
        }

        ReferenceBridge owner() {
            return ReferenceBridge.this;
        }

        boolean isReleased() {
            return released.get();
        }

        boolean release() {
            if (!released.compareAndSet(false, true)) {
                return false;
            }
            return watch.release();
        }

        /** Runs once the watch fires. */
        void onFired() {
            released.set(true);
            liveProxies.decrementAndGet();
            WeakReference<Object> ref = memoRef;
            if (memoKey != null && ref != null) {
                memo.remove(memoKey, ref);
            }
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            Class<?> declaring = method.getDeclaringClass();
            if (declaring == Object.class) {
                return switch (method.getName()) {
                    case "equals" -> proxy == args[0];
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "toString" -> capability.name() + "Proxy[" + Handle.fromRaw(foreignHandle) + (released.get() ? ", released" : "") + "]";
                    default -> throw new NoSuchSelectorException("Unsupported Object method " + method.getName());
                };
            }
            if (declaring == ForeignProxy.class) {
                return switch (method.getName()) {
                    case "foreignHandle" -> foreignHandle;
                    case "foreignCapability" -> capability.name();
                    case "isReleased" -> released.get();
                    default -> throw new NoSuchSelectorException("Unsupported ForeignProxy method " + method.getName());
                };
            }
            MethodSignature signature = capability.forJavaMethod(method);
            if (signature == null) {
                if (method.isDefault()) {
                    return InvocationHandler.invokeDefault(proxy, method, args);
                }
                throw new NoSuchSelectorException("Method " + method.getName() + " is not bound in capability " + capability.name());
            }
            if (released.get()) {
                throw new StaleHandleException(foreignHandle, capability.name() + " proxy for " + Handle.fromRaw(foreignHandle) + " was released");
            }
            return forward(this, proxy, signature, args);
        }
    }
}
