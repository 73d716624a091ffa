package com.acme.interop.bridge.handle;

public enum ReleaseResult {
    /** The last reference was dropped; the slot is free and the handle is now stale. */
    RELEASED,
    /** One reference was dropped; others remain and the handle stays live. */
    RETAINED,
    /** The handle was already stale. Nothing changed. */
    STALE
}
