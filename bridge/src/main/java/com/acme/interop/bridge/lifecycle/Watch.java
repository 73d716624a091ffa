package com.acme.interop.bridge.lifecycle;

import java.lang.ref.Cleaner;

/**
 * Finalization watch on one object. Fires once, either when the object is collected or when
 * {@link #release()} is called first.
 */
public final class Watch {
    private final Cleaner.Cleanable cleanable;
    private final LifecycleMonitor.Signaller signaller;

    Watch(Cleaner.Cleanable cleanable, LifecycleMonitor.Signaller signaller) {
        this.cleanable = cleanable;
        this.signaller = signaller;
    }

    public long rawHandle() {
        return signaller.rawHandle();
    }

    public boolean fired() {
        return signaller.fired();
    }

    /**
     * Releases the watched handle now, bypassing the signal queue.
     *
     * @return {@code false} if the watch had already fired
     */
    public boolean release() {
        boolean first = signaller.fireDirect();
        cleanable.clean();
        return first;
    }
}
