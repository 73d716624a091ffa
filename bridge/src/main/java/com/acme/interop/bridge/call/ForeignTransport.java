package com.acme.interop.bridge.call;

import com.acme.interop.bridge.handle.ReleaseResult;
import com.acme.interop.bridge.handle.ReleaseSink;

/**
 * Carries calls and release notices to the foreign runtime.
 */
public interface ForeignTransport extends ReleaseSink, AutoCloseable {

    /**
     * Hands a {@link CallState#SENT} call to the foreign side. The transport must eventually
     * {@link PendingCall#complete complete} it, possibly on another thread.
     *
     * @throws com.acme.interop.bridge.error.BridgeException with kind {@code TRANSPORT} if the
     *         call cannot be handed over
     */
    void send(PendingCall call);

    /** Drops one reference to a handle in the foreign table. */
    @Override
    ReleaseResult release(long foreignHandle);

    @Override
    void close();
}
