package com.acme.interop.bridge.handle;

import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;

/**
 * Thrown when every stripe of a {@link HandleTable} is full. Callers may retry once handles
 * have been released.
 */
public final class HandleTableExhaustedException extends BridgeException {
    private final int capacity;

    public HandleTableExhaustedException(int capacity) {
        super(FailureKind.RESOURCE_EXHAUSTED, "Handle table exhausted, capacity=" + capacity);
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
