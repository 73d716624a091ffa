package com.acme.interop.bridge.telemetry;

import com.acme.interop.bridge.error.FailureKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicBridgeMetrics implements BridgeMetrics {
    private final LongAdder outboundCalls = new LongAdder();
    private final LongAdder inboundCalls = new LongAdder();
    private final LongAdder callNanos = new LongAdder();
    private final LongAdder callSamples = new LongAdder();
    private final LongAdder signalsEmitted = new LongAdder();
    private final LongAdder signalsDropped = new LongAdder();
    private final LongAdder signalsDrained = new LongAdder();
    private final LongAdder threadAttachments = new LongAdder();
    private final AtomicInteger liveHandles = new AtomicInteger();
    private final ConcurrentHashMap<FailureKind, LongAdder> failuresByKind = new ConcurrentHashMap<>();

    private static final int LATENCY_RING_SIZE = 4096;
    private static final int LATENCY_RING_MASK = LATENCY_RING_SIZE - 1;
    private final AtomicLongArray latencyRing = new AtomicLongArray(LATENCY_RING_SIZE);
    private final AtomicLong latencyRingPos = new AtomicLong();

    @Override
    public void incOutboundCalls(long n) {
        outboundCalls.add(Math.max(0L, n));
    }

    @Override
    public void incInboundCalls(long n) {
        inboundCalls.add(Math.max(0L, n));
    }

    @Override
    public void incFailures(long n, FailureKind kind) {
        if (n <= 0 || kind == null) return;
        failuresByKind.computeIfAbsent(kind, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void observeCallNanos(long nanos) {
        if (nanos < 0) return;
        callNanos.add(nanos);
        callSamples.increment();
        latencyRing.set((int) (latencyRingPos.getAndIncrement() & LATENCY_RING_MASK), nanos);
    }

    @Override
    public void incSignalsEmitted(long n) {
        signalsEmitted.add(Math.max(0L, n));
    }

    @Override
    public void incSignalsDropped(long n) {
        signalsDropped.add(Math.max(0L, n));
    }

    @Override
    public void incSignalsDrained(long n) {
        signalsDrained.add(Math.max(0L, n));
    }

    @Override
    public void incThreadAttachments(long n) {
        threadAttachments.add(Math.max(0L, n));
    }

    @Override
    public void setLiveHandles(int live) {
        liveHandles.set(Math.max(0, live));
    }

    public long p99LatencyNanos() {
        long pos = latencyRingPos.get();
        int count = (int) Math.min(pos, LATENCY_RING_SIZE);
        if (count == 0) return 0;
        long[] samples = new long[count];
        int start = (int) ((pos - count) & LATENCY_RING_MASK);
        for (int i = 0; i < count; i++) {
            samples[i] = latencyRing.get((start + i) & LATENCY_RING_MASK);
        }
        Arrays.sort(samples);
        int idx = Math.min((int) (count * 0.99), count - 1);
        return samples[idx];
    }

    public Snapshot snapshot() {
        Map<FailureKind, Long> failures = new EnumMap<>(FailureKind.class);
        failuresByKind.forEach((k, v) -> failures.put(k, v.sum()));
        return new Snapshot(
            outboundCalls.sum(),
            inboundCalls.sum(),
            callNanos.sum(),
            callSamples.sum(),
            p99LatencyNanos(),
            signalsEmitted.sum(),
            signalsDropped.sum(),
            signalsDrained.sum(),
            threadAttachments.sum(),
            liveHandles.get(),
            Collections.unmodifiableMap(failures)
        );
    }

    public record Snapshot(long outboundCalls,
                           long inboundCalls,
                           long callNanosTotal,
                           long callSamples,
                           long callP99Nanos,
                           long signalsEmitted,
                           long signalsDropped,
                           long signalsDrained,
                           long threadAttachments,
                           int liveHandles,
                           Map<FailureKind, Long> failuresByKind) {

        public long failures(FailureKind kind) {
            return failuresByKind.getOrDefault(kind, 0L);
        }
    }
}
