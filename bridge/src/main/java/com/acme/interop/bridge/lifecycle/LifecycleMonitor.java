package com.acme.interop.bridge.lifecycle;

import com.acme.interop.bridge.handle.ReleaseSink;
import com.acme.interop.bridge.telemetry.BridgeMetrics;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns collection of watched objects into {@link CollectionSignal}s and hands them to a
 * {@link ReleaseSink} when drained.
 *
 * <p>Signals wait in a bounded queue until {@link #drainSignals} is called. A full queue is
 * handled per {@link OverflowPolicy}, so a peer that never drains cannot grow memory without
 * bound. After {@link #close()} signals bypass the queue.</p>
 */
public final class LifecycleMonitor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LifecycleMonitor.class.getName());

    private final Cleaner cleaner;
    private final BlockingQueue<CollectionSignal> queue;
    private final OverflowPolicy overflowPolicy;
    private final ReleaseSink sink;
    private final BridgeMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong emitted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();

    public LifecycleMonitor(String name,
                            int queueCapacity,
                            OverflowPolicy overflowPolicy,
                            ReleaseSink sink,
                            BridgeMetrics metrics) {
        this.cleaner = Cleaner.create(new DefaultThreadFactory("bridge-cleaner-" + Objects.requireNonNull(name, "name"), true));
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Watches {@code object}; once it is unreachable, one signal for {@code rawHandle} is emitted.
     */
    public Watch onExposed(long rawHandle, Object object) {
        return onExposed(rawHandle, object, null);
    }

    /**
     * @param onFired runs once after the watch fires, on whichever thread fired it; must not
     *                reference {@code object}
     */
    public Watch onExposed(long rawHandle, Object object, Runnable onFired) {
        Objects.requireNonNull(object, "object");
        Signaller signaller = new Signaller(this, rawHandle, onFired);
        return new Watch(cleaner.register(object, signaller), signaller);
    }

    /**
     * Delivers up to {@code max} queued signals to the release sink, waiting until
     * {@code timeout} has elapsed for more to arrive. Never blocks past the deadline. A
     * {@code null} or non-positive timeout delivers only what is already queued.
     *
     * @return number of signals delivered
     */
    public int drainSignals(int max, Duration timeout) {
        if (max <= 0) {
            return 0;
        }
        long waitNanos = timeout == null ? 0L : Math.max(0L, timeout.toNanos());
        long deadline = System.nanoTime() + waitNanos;
        int drained = 0;
        while (drained < max) {
            CollectionSignal signal = queue.poll();
            if (signal == null) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                try {
                    signal = queue.poll(remaining, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (signal == null) {
                    break;
                }
            }
            deliver(signal);
            drained++;
        }
        if (drained > 0) {
            metrics.incSignalsDrained(drained);
        }
        return drained;
    }

    public int pendingSignals() {
        return queue.size();
    }

    public long emittedSignals() {
        return emitted.get();
    }

    public long droppedSignals() {
        return dropped.get();
    }

    public long deliveredSignals() {
        return delivered.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Flushes queued signals to the sink. Later signals are delivered as they are emitted.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int flushed = 0;
        CollectionSignal signal;
        while ((signal = queue.poll()) != null) {
            deliver(signal);
            flushed++;
        }
        if (flushed > 0) {
            metrics.incSignalsDrained(flushed);
        }
        LOG.fine("Lifecycle monitor closed flushedSignals=" + flushed + " droppedSignals=" + dropped.get());
    }

    private void emit(long rawHandle) {
        emitted.incrementAndGet();
        metrics.incSignalsEmitted(1);
        CollectionSignal signal = new CollectionSignal(rawHandle, System.nanoTime());
        if (closed.get()) {
            deliver(signal);
            return;
        }
        if (queue.offer(signal)) {
            return;
        }
        if (overflowPolicy == OverflowPolicy.RELEASE_INLINE) {
            deliver(signal);
            return;
        }
        CollectionSignal evicted = queue.poll();
        if (evicted != null) {
            dropped.incrementAndGet();
            metrics.incSignalsDropped(1);
            LOG.warning("Collection signal queue full, dropped signal for handle " + evicted.rawHandle());
        }
        if (!queue.offer(signal)) {
            dropped.incrementAndGet();
            metrics.incSignalsDropped(1);
            LOG.warning("Collection signal queue full, dropped signal for handle " + rawHandle);
        }
    }

    private void deliver(CollectionSignal signal) {
        try {
            sink.release(signal.rawHandle());
            delivered.incrementAndGet();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Release of handle " + signal.rawHandle() + " failed", e);
        }
    }

    /**
     * Cleaning action. Holds no reference to the watched object.
     */
    static final class Signaller implements Runnable {
        private final LifecycleMonitor monitor;
        private final long rawHandle;
        private final Runnable onFired;
        private final AtomicBoolean fired = new AtomicBoolean();

        Signaller(LifecycleMonitor monitor, long rawHandle, Runnable onFired) {
            this.monitor = monitor;
            this.rawHandle = rawHandle;
            this.onFired = onFired;
        }

        long rawHandle() {
            return rawHandle;
        }

        boolean fired() {
            return fired.get();
        }

        @Override
        public void run() {
            if (fired.compareAndSet(false, true)) {
                monitor.emit(rawHandle);
                afterFire();
            }
        }

        boolean fireDirect() {
            if (!fired.compareAndSet(false, true)) {
                return false;
            }
            monitor.deliver(new CollectionSignal(rawHandle, System.nanoTime()));
            afterFire();
            return true;
        }

        private void afterFire() {
            if (onFired == null) {
                return;
            }
            try {
                onFired.run();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Post-collection hook failed for handle " + rawHandle, e);
            }
        }
    }
}
