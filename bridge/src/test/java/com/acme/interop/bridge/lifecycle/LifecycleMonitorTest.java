package com.acme.interop.bridge.lifecycle;

import com.acme.interop.bridge.fixture.GcAwait;
import com.acme.interop.bridge.handle.ReleaseResult;
import com.acme.interop.bridge.handle.ReleaseSink;
import com.acme.interop.bridge.telemetry.AtomicBridgeMetrics;
import com.acme.interop.bridge.telemetry.NoopBridgeMetrics;
import org.junit.jupiter.api.Test;

import java.lang.ref.Reference;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifecycleMonitorTest {
    private static final Duration GC_TIMEOUT = Duration.ofSeconds(10);

    private final List<Long> released = Collections.synchronizedList(new ArrayList<>());
    private final ReleaseSink sink = raw -> {
        released.add(raw);
        return ReleaseResult.RELEASED;
    };

    @Test
    void shouldQueueSignalUntilDrained() {
        AtomicBridgeMetrics metrics = new AtomicBridgeMetrics();
        LifecycleMonitor monitor = new LifecycleMonitor("queue", 16, OverflowPolicy.DROP_OLDEST, sink, metrics);
        watchGarbage(monitor, 42L);

        assertTrue(GcAwait.until(() -> monitor.pendingSignals() == 1, GC_TIMEOUT), "Watched object was not collected");
        assertTrue(released.isEmpty());

        assertEquals(1, monitor.drainSignals(10, Duration.ofMillis(10)));
        assertEquals(List.of(42L), released);
        assertEquals(1L, monitor.deliveredSignals());
        assertEquals(1L, metrics.snapshot().signalsEmitted());
        assertEquals(1L, metrics.snapshot().signalsDrained());
    }

    @Test
    void shouldDropOldestWhenQueueIsFull() {
        LifecycleMonitor monitor = new LifecycleMonitor("drop", 2, OverflowPolicy.DROP_OLDEST, sink, NoopBridgeMetrics.INSTANCE);
        for (long raw = 1; raw <= 3; raw++) {
            watchGarbage(monitor, raw);
        }

        assertTrue(GcAwait.until(() -> monitor.emittedSignals() == 3, GC_TIMEOUT), "Watched objects were not collected");
        assertEquals(2, monitor.pendingSignals());
        assertEquals(1L, monitor.droppedSignals());

        assertEquals(2, monitor.drainSignals(10, Duration.ZERO));
        assertEquals(2, released.size());
    }

    @Test
    void shouldReleaseInlineWhenQueueIsFull() {
        LifecycleMonitor monitor = new LifecycleMonitor("inline", 1, OverflowPolicy.RELEASE_INLINE, sink, NoopBridgeMetrics.INSTANCE);
        for (long raw = 1; raw <= 3; raw++) {
            watchGarbage(monitor, raw);
        }

        assertTrue(GcAwait.until(() -> monitor.emittedSignals() == 3, GC_TIMEOUT), "Watched objects were not collected");
        assertEquals(1, monitor.pendingSignals());
        assertEquals(2, released.size());
        assertEquals(0L, monitor.droppedSignals());

        monitor.drainSignals(10, Duration.ZERO);
        assertEquals(3, released.size());
    }

    @Test
    void shouldReleaseDirectlyOnceWhenWatchIsReleased() {
        LifecycleMonitor monitor = new LifecycleMonitor("direct", 16, OverflowPolicy.DROP_OLDEST, sink, NoopBridgeMetrics.INSTANCE);
        AtomicInteger hooks = new AtomicInteger();
        Object watched = new Object();
        Watch watch = monitor.onExposed(7L, watched, hooks::incrementAndGet);

        assertTrue(watch.release());
        assertFalse(watch.release());

        assertTrue(watch.fired());
        assertEquals(List.of(7L), released);
        assertEquals(1, hooks.get());
        assertEquals(0, monitor.pendingSignals());
        Reference.reachabilityFence(watched);
    }

    @Test
    void shouldReturnWithinDeadlineWhenNothingIsPending() {
        LifecycleMonitor monitor = new LifecycleMonitor("idle", 16, OverflowPolicy.DROP_OLDEST, sink, NoopBridgeMetrics.INSTANCE);
        long start = System.nanoTime();

        assertEquals(0, monitor.drainSignals(5, Duration.ofMillis(50)));
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(2).toNanos());
        assertEquals(0, monitor.drainSignals(0, Duration.ofSeconds(5)));
    }

    @Test
    void shouldDrainOnlyQueuedSignalsWithoutTimeout() {
        LifecycleMonitor monitor = new LifecycleMonitor("no-wait", 16, OverflowPolicy.DROP_OLDEST, sink, NoopBridgeMetrics.INSTANCE);
        assertEquals(0, monitor.drainSignals(5, null));

        watchGarbage(monitor, 9L);
        assertTrue(GcAwait.until(() -> monitor.pendingSignals() == 1, GC_TIMEOUT), "Watched object was not collected");

        assertEquals(1, monitor.drainSignals(5, null));
        assertEquals(List.of(9L), released);
    }

    @Test
    void shouldFlushOnCloseAndDeliverLaterSignalsInline() {
        LifecycleMonitor monitor = new LifecycleMonitor("close", 16, OverflowPolicy.DROP_OLDEST, sink, NoopBridgeMetrics.INSTANCE);
        watchGarbage(monitor, 1L);
        assertTrue(GcAwait.until(() -> monitor.pendingSignals() == 1, GC_TIMEOUT), "Watched object was not collected");

        monitor.close();
        assertTrue(monitor.isClosed());
        assertEquals(List.of(1L), released);

        watchGarbage(monitor, 2L);
        assertTrue(GcAwait.until(() -> released.size() == 2, GC_TIMEOUT), "Signal after close was not delivered");
        assertEquals(0, monitor.pendingSignals());
    }

    @Test
    void shouldKeepDeliveringWhenSinkFails() {
        List<Long> seen = Collections.synchronizedList(new ArrayList<>());
        ReleaseSink failing = raw -> {
            seen.add(raw);
            throw new IllegalStateException("peer gone");
        };
        LifecycleMonitor monitor = new LifecycleMonitor("failing", 16, OverflowPolicy.DROP_OLDEST, failing, NoopBridgeMetrics.INSTANCE);
        Object first = new Object();
        Object second = new Object();
        monitor.onExposed(1L, first).release();
        monitor.onExposed(2L, second).release();
        Reference.reachabilityFence(first);
        Reference.reachabilityFence(second);

        assertEquals(List.of(1L, 2L), seen);
        assertEquals(0L, monitor.deliveredSignals());
    }

    private static void watchGarbage(LifecycleMonitor monitor, long raw) {
        monitor.onExposed(raw, new Object());
    }
}
