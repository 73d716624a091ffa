package com.acme.interop.bridge.call;

/**
 * {@code CREATED -> SENT -> COMPLETED | FAILED}. {@code SENT -> ABANDONED} when the waiter gives
 * up; a completion arriving afterwards is discarded.
 */
public enum CallState {
    CREATED,
    SENT,
    COMPLETED,
    FAILED,
    ABANDONED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == ABANDONED;
    }
}
