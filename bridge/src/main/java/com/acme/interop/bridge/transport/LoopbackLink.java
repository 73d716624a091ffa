package com.acme.interop.bridge.transport;

import io.netty.util.concurrent.FastThreadLocal;

/**
 * Delivery depth shared by the two transports of a loopback pair. A thread with depth above
 * zero is already running a call from the other side, so further calls it makes run inline.
 */
public final class LoopbackLink {
    private final FastThreadLocal<int[]> depth = new FastThreadLocal<>() {
        @Override
        protected int[] initialValue() {
            return new int[1];
        }
    };

    public boolean inDelivery() {
        return depth.get()[0] > 0;
    }

    void enter() {
        depth.get()[0]++;
    }

    void exit() {
        int[] d = depth.get();
        if (--d[0] == 0) {
            depth.remove();
        }
    }
}
