package com.acme.interop.bridge.handle;

import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;

/**
 * Thrown when a handle no longer names a live slot: it was released, its slot was reused,
 * or it was never issued by this table.
 */
public final class StaleHandleException extends BridgeException {
    private final long rawHandle;

    public StaleHandleException(long rawHandle) {
        super(FailureKind.STALE_HANDLE, "Stale handle " + Handle.fromRaw(rawHandle));
        this.rawHandle = rawHandle;
    }

    public StaleHandleException(long rawHandle, String message) {
        super(FailureKind.STALE_HANDLE, message);
        this.rawHandle = rawHandle;
    }

    public long rawHandle() {
        return rawHandle;
    }
}
