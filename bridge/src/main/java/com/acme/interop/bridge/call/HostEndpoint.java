package com.acme.interop.bridge.call;

import com.acme.interop.bridge.catalog.Selector;
import com.acme.interop.bridge.handle.ReleaseResult;
import com.acme.interop.bridge.wire.WireValue;

import java.util.List;

/**
 * The two operations the foreign runtime calls into.
 */
public interface HostEndpoint {

    /**
     * Never throws: every failure comes back as {@link CallOutcome.Failed}.
     */
    CallOutcome invokeHost(long handle, Selector selector, List<WireValue> args);

    ReleaseResult release(long handle);
}
