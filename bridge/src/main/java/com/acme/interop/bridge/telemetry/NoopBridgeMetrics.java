package com.acme.interop.bridge.telemetry;

import com.acme.interop.bridge.error.FailureKind;

public final class NoopBridgeMetrics implements BridgeMetrics {
    public static final NoopBridgeMetrics INSTANCE = new NoopBridgeMetrics();

    private NoopBridgeMetrics() {
    }

    @Override
    public void incOutboundCalls(long n) {
    }

    @Override
    public void incInboundCalls(long n) {
    }

    @Override
    public void incFailures(long n, FailureKind kind) {
    }

    @Override
    public void observeCallNanos(long nanos) {
    }

    @Override
    public void incSignalsEmitted(long n) {
    }

    @Override
    public void incSignalsDropped(long n) {
    }

    @Override
    public void incSignalsDrained(long n) {
    }

    @Override
    public void incThreadAttachments(long n) {
    }

    @Override
    public void setLiveHandles(int live) {
    }
}
