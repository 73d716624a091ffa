package com.acme.interop.bridge.wire;

import java.util.Objects;

/**
 * An object reference as it crosses the boundary: the side whose table owns it plus the raw
 * handle value in that table.
 *
 * <p>{@link #NULL} is the only reference with owner {@link Side#NONE}. Its raw value
 * ({@value #NULL_RAW}) has a negative index and is never produced by a handle table, so it
 * cannot be confused with a live handle whose raw value happens to be zero.</p>
 */
public record WireRef(Side owner, long raw) {
    public static final long NULL_RAW = -1L;
    public static final WireRef NULL = new WireRef(Side.NONE, NULL_RAW);

    public WireRef {
        Objects.requireNonNull(owner, "owner");
        if ((owner == Side.NONE) != (raw == NULL_RAW)) {
            throw new IllegalArgumentException("owner NONE is reserved for the null sentinel, got " + owner + "/" + raw);
        }
    }

    public static WireRef of(Side owner, long raw) {
        if (owner == Side.NONE) {
            throw new IllegalArgumentException("Use WireRef.NULL for absent references");
        }
        return new WireRef(owner, raw);
    }

    public boolean isNull() {
        return owner == Side.NONE;
    }
}
