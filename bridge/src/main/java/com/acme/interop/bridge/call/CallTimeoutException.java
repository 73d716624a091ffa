package com.acme.interop.bridge.call;

import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;

/**
 * A bounded wait for a foreign call expired. The call itself may still complete later; its
 * result is then discarded.
 */
public final class CallTimeoutException extends BridgeException {
    private final long callId;

    public CallTimeoutException(long callId, String message) {
        super(FailureKind.TIMEOUT, message);
        this.callId = callId;
    }

    public long callId() {
        return callId;
    }
}
