package com.acme.interop.bridge.telemetry;

import com.acme.interop.bridge.error.FailureKind;

public interface BridgeMetrics {
    void incOutboundCalls(long n);
    void incInboundCalls(long n);
    void incFailures(long n, FailureKind kind);
    void observeCallNanos(long nanos);
    void incSignalsEmitted(long n);
    void incSignalsDropped(long n);
    void incSignalsDrained(long n);
    void incThreadAttachments(long n);
    void setLiveHandles(int live);
}
