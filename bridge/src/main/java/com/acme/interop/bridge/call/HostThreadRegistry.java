package com.acme.interop.bridge.call;

import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;
import com.acme.interop.bridge.telemetry.BridgeMetrics;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Tracks threads that run foreign-originated work on this side.
 *
 * <p>The first {@link #enter()} on a thread attaches it; the attachment is kept for later calls
 * on the same thread. Nested entries only bump a depth counter. Each entry is a
 * {@link ThreadScope} and must be closed, which try-with-resources does on every path.</p>
 */
public final class HostThreadRegistry implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(HostThreadRegistry.class.getName());

    private final String name;
    private final BridgeMetrics metrics;
    private final ThreadLocal<Attachment> current = new ThreadLocal<>();
    private final Map<Thread, Boolean> attached = Collections.synchronizedMap(new WeakHashMap<>());
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong attachCount = new AtomicLong();

    public HostThreadRegistry(String name, BridgeMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @throws BridgeException with kind {@code TRANSPORT} once the registry is closed
     */
    public ThreadScope enter() {
        if (closed.get()) {
            throw new BridgeException(FailureKind.TRANSPORT, "Bridge " + name + " is shut down");
        }
        Attachment attachment = current.get();
        if (attachment == null) {
            attachment = attach();
        }
        attachment.depth++;
        return new ThreadScope(attachment);
    }

    public boolean isAttached() {
        return current.get() != null;
    }

    public int depth() {
        Attachment attachment = current.get();
        return attachment == null ? 0 : attachment.depth;
    }

    /** Number of distinct live threads currently attached. */
    public int attachedThreads() {
        return attached.size();
    }

    /** Number of attach operations since creation. */
    public long attachCount() {
        return attachCount.get();
    }

    /**
     * Detaches the calling thread. Fails if the thread is inside a scope.
     */
    public void detachCurrentThread() {
        Attachment attachment = current.get();
        if (attachment == null) {
            return;
        }
        if (attachment.depth > 0) {
            throw new IllegalStateException("Cannot detach " + attachment.thread.getName() + " at depth " + attachment.depth);
        }
        current.remove();
        attached.remove(attachment.thread);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.fine("Thread registry " + name + " closed attachedThreads=" + attached.size());
        }
    }

    private Attachment attach() {
        Thread thread = Thread.currentThread();
        Attachment attachment = new Attachment(thread);
        current.set(attachment);
        attached.put(thread, Boolean.TRUE);
        attachCount.incrementAndGet();
        metrics.incThreadAttachments(1);
        LOG.fine(() -> "Attached thread " + thread.getName() + " to " + name);
        return attachment;
    }

    private static final class Attachment {
        private final Thread thread;
        private int depth;

        private Attachment(Thread thread) {
            this.thread = thread;
        }
    }

    /**
     * One entry into the bridge on an attached thread.
     */
    public static final class ThreadScope implements AutoCloseable {
        private final Attachment attachment;
        private boolean closed;

        private ThreadScope(Attachment attachment) {
            this.attachment = attachment;
        }

        public int depth() {
            return attachment.depth;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (Thread.currentThread() != attachment.thread) {
                throw new IllegalStateException("ThreadScope closed on " + Thread.currentThread().getName()
                    + " but opened on " + attachment.thread.getName());
            }
            closed = true;
            attachment.depth--;
        }
    }
}
