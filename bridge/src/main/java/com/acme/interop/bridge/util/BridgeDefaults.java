package com.acme.interop.bridge.util;

/**
 * Default capacity, timeout, and tuning constants for the bridge runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class BridgeDefaults {

    // ---- Handle table ----
    public static final int DEFAULT_HANDLE_CAPACITY = 1 << 20;
    public static final int MAX_HANDLE_CAPACITY = 1 << 30;
    public static final int DEFAULT_HANDLE_STRIPES = 16;
    public static final int MAX_HANDLE_STRIPES = 1024;
    public static final int INITIAL_SLOTS_PER_STRIPE = 16;

    // ---- Lifecycle ----
    public static final int DEFAULT_SIGNAL_QUEUE_CAPACITY = 4096;
    public static final int MAX_SIGNAL_QUEUE_CAPACITY = 1 << 20;

    // ---- Calls ----
    public static final long DEFAULT_CALL_TIMEOUT_MS = 0L;
    public static final long MAX_CALL_TIMEOUT_MS = 24L * 60 * 60 * 1000;

    // ---- Loopback transport ----
    public static final int DEFAULT_FOREIGN_THREADS = 4;
    public static final int MAX_FOREIGN_THREADS = 256;

    // ---- Shutdown ----
    public static final long SHUTDOWN_QUIET_PERIOD_MS = 0L;
    public static final long SHUTDOWN_TIMEOUT_MS = 5_000L;

    // ---- Metrics ----
    public static final long DEFAULT_METRICS_LOG_INTERVAL_SEC = 0L;

    private BridgeDefaults() {
    }
}
