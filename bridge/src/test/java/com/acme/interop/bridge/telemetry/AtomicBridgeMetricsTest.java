package com.acme.interop.bridge.telemetry;

import com.acme.interop.bridge.error.FailureKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AtomicBridgeMetricsTest {

    @Test
    void p99ShouldReturnZeroWhenNoSamples() {
        AtomicBridgeMetrics metrics = new AtomicBridgeMetrics();
        assertEquals(0L, metrics.p99LatencyNanos());
    }

    @Test
    void p99ShouldApproximateCorrectPercentile() {
        AtomicBridgeMetrics metrics = new AtomicBridgeMetrics();
        for (int i = 1; i <= 100; i++) {
            metrics.observeCallNanos(i * 1000L);
        }
        long p99 = metrics.p99LatencyNanos();
        assertTrue(p99 >= 99_000L, "Expected p99 >= 99000 but got " + p99);
    }

    @Test
    void p99ShouldHandleRingBufferWraparound() {
        AtomicBridgeMetrics metrics = new AtomicBridgeMetrics();
        for (int i = 0; i < 5000; i++) {
            metrics.observeCallNanos(1000L);
        }
        metrics.observeCallNanos(999_000L);
        assertTrue(metrics.p99LatencyNanos() >= 1000L);
        assertEquals(5001L, metrics.snapshot().callSamples());
    }

    @Test
    void snapshotShouldGroupFailuresByKind() {
        AtomicBridgeMetrics metrics = new AtomicBridgeMetrics();
        metrics.incFailures(2, FailureKind.STALE_HANDLE);
        metrics.incFailures(1, FailureKind.DOMAIN);
        metrics.incFailures(0, FailureKind.DOMAIN);
        metrics.incFailures(5, null);

        AtomicBridgeMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(2L, snapshot.failures(FailureKind.STALE_HANDLE));
        assertEquals(1L, snapshot.failures(FailureKind.DOMAIN));
        assertEquals(0L, snapshot.failures(FailureKind.TIMEOUT));
    }

    @Test
    void negativeValuesShouldBeIgnored() {
        AtomicBridgeMetrics metrics = new AtomicBridgeMetrics();
        metrics.observeCallNanos(-1L);
        metrics.incOutboundCalls(-3L);
        metrics.incSignalsDropped(-1L);
        metrics.setLiveHandles(-4);

        AtomicBridgeMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(0L, snapshot.callSamples());
        assertEquals(0L, snapshot.outboundCalls());
        assertEquals(0L, snapshot.signalsDropped());
        assertEquals(0, snapshot.liveHandles());
    }
}
