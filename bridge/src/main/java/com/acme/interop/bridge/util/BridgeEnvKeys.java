package com.acme.interop.bridge.util;

/**
 * Canonical environment variable names used by the bridge runtime.
 */
public final class BridgeEnvKeys {
    public static final String BRIDGE_HANDLE_CAPACITY = "BRIDGE_HANDLE_CAPACITY";
    public static final String BRIDGE_HANDLE_STRIPES = "BRIDGE_HANDLE_STRIPES";

    public static final String BRIDGE_SIGNAL_QUEUE_CAPACITY = "BRIDGE_SIGNAL_QUEUE_CAPACITY";
    public static final String BRIDGE_SIGNAL_OVERFLOW = "BRIDGE_SIGNAL_OVERFLOW";

    public static final String BRIDGE_CALL_TIMEOUT_MS = "BRIDGE_CALL_TIMEOUT_MS";
    public static final String BRIDGE_FOREIGN_THREADS = "BRIDGE_FOREIGN_THREADS";

    public static final String BRIDGE_METRICS_LOG_INTERVAL_SEC = "BRIDGE_METRICS_LOG_INTERVAL_SEC";

    private BridgeEnvKeys() {
    }
}
