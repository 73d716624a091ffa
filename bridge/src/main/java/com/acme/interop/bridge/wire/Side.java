package com.acme.interop.bridge.wire;

/**
 * Which runtime's handle table a reference lives in.
 */
public enum Side {
    NONE,
    HOST,
    FOREIGN;

    public Side peer() {
        return switch (this) {
            case HOST -> FOREIGN;
            case FOREIGN -> HOST;
            case NONE -> throw new IllegalStateException("NONE has no peer");
        };
    }
}
