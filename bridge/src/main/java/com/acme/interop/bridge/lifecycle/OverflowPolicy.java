package com.acme.interop.bridge.lifecycle;

/**
 * What the monitor does with a signal when its queue is full.
 */
public enum OverflowPolicy {
    /** Evict the oldest queued signal; its handle stays registered until shutdown. */
    DROP_OLDEST,
    /** Hand the new signal straight to the release sink on the emitting thread. */
    RELEASE_INLINE
}
