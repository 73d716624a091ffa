package com.acme.interop.bridge.wire;

import com.acme.interop.bridge.handle.Handle;
import com.acme.interop.bridge.handle.HandleTable;

import java.util.Objects;
import java.util.function.Function;

/**
 * Canonical encoding of "no object" across the boundary.
 *
 * <p>{@code null} encodes to {@link WireRef#NULL} and the sentinel decodes to {@code null}
 * without touching the handle table. Live values go to the caller's strategy, which decides how
 * an object obtains its reference (exposure, an existing proxy handle) and how a live reference
 * becomes an object again.</p>
 */
public final class NullGuard {
    private final Side side;
    private final HandleTable table;

    public NullGuard(Side side, HandleTable table) {
        if (Objects.requireNonNull(side, "side") == Side.NONE) {
            throw new IllegalArgumentException("side must be HOST or FOREIGN");
        }
        this.side = side;
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * @param live encodes a non-null object; must not produce the sentinel
     * @throws IllegalStateException if {@code live} encoded an object as {@link WireRef#NULL}
     */
    public WireRef encode(Object object, Function<Object, WireRef> live) {
        if (object == null) {
            return WireRef.NULL;
        }
        WireRef ref = Objects.requireNonNull(live.apply(object), "live encoding");
        if (ref.isNull()) {
            throw new IllegalStateException("Live object " + object.getClass().getName() + " encoded as the null reference");
        }
        return ref;
    }

    /**
     * @param live decodes a reference that is not the sentinel
     */
    public <T> T decode(WireRef ref, Function<WireRef, T> live) {
        if (ref == null || ref.isNull()) {
            return null;
        }
        return live.apply(ref);
    }

    /** Decodes the sentinel or a reference owned by this side. */
    public Object decode(WireRef ref) {
        return decode(ref, this::resolveOwned);
    }

    public WireRef owned(Handle handle) {
        return WireRef.of(side, handle.toRaw());
    }

    /**
     * @throws IllegalArgumentException if the reference belongs to the other side's table
     * @throws com.acme.interop.bridge.handle.StaleHandleException if the handle is stale
     */
    public Object resolveOwned(WireRef ref) {
        if (ref.owner() != side) {
            throw new IllegalArgumentException("Reference owned by " + ref.owner() + " cannot be decoded on " + side);
        }
        return table.resolve(ref.raw());
    }

    public Side side() {
        return side;
    }
}
