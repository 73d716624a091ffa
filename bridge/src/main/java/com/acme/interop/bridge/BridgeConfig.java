package com.acme.interop.bridge;

import com.acme.interop.bridge.lifecycle.OverflowPolicy;
import com.acme.interop.bridge.util.BridgeDefaults;
import com.acme.interop.bridge.util.BridgeEnvKeys;
import com.acme.interop.bridge.util.EnvVars;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime settings of one bridge side.
 *
 * @param callTimeout default bounded wait for outbound calls; zero waits until completion
 * @param metricsLogIntervalSec zero disables the periodic metrics log line
 */
public record BridgeConfig(int handleCapacity,
                           int handleStripes,
                           int signalQueueCapacity,
                           OverflowPolicy signalOverflow,
                           Duration callTimeout,
                           int foreignThreads,
                           long metricsLogIntervalSec) {

    public BridgeConfig {
        if (handleStripes <= 0 || (handleStripes & (handleStripes - 1)) != 0) {
            throw new IllegalArgumentException("handleStripes must be a positive power of two, got " + handleStripes);
        }
        if (handleCapacity < handleStripes) {
            throw new IllegalArgumentException("handleCapacity (" + handleCapacity + ") must be >= handleStripes (" + handleStripes + ")");
        }
        if (signalQueueCapacity <= 0) {
            throw new IllegalArgumentException("signalQueueCapacity must be positive, got " + signalQueueCapacity);
        }
        Objects.requireNonNull(signalOverflow, "signalOverflow");
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must not be negative");
        }
        if (foreignThreads <= 0) {
            throw new IllegalArgumentException("foreignThreads must be positive, got " + foreignThreads);
        }
        if (metricsLogIntervalSec < 0) {
            throw new IllegalArgumentException("metricsLogIntervalSec must not be negative");
        }
    }

    public static BridgeConfig defaults() {
        return fromEnv(Map.of());
    }

    public static BridgeConfig fromSystemEnv() {
        return fromEnv(System.getenv());
    }

    public static BridgeConfig fromEnv(Map<String, String> env) {
        int capacity = EnvVars.getIntClamped(env, BridgeEnvKeys.BRIDGE_HANDLE_CAPACITY,
            BridgeDefaults.DEFAULT_HANDLE_CAPACITY, 1, BridgeDefaults.MAX_HANDLE_CAPACITY);
        int stripes = EnvVars.getIntClamped(env, BridgeEnvKeys.BRIDGE_HANDLE_STRIPES,
            BridgeDefaults.DEFAULT_HANDLE_STRIPES, 1, BridgeDefaults.MAX_HANDLE_STRIPES);
        int signalQueue = EnvVars.getIntClamped(env, BridgeEnvKeys.BRIDGE_SIGNAL_QUEUE_CAPACITY,
            BridgeDefaults.DEFAULT_SIGNAL_QUEUE_CAPACITY, 1, BridgeDefaults.MAX_SIGNAL_QUEUE_CAPACITY);
        OverflowPolicy overflow = EnvVars.getEnum(env, BridgeEnvKeys.BRIDGE_SIGNAL_OVERFLOW,
            OverflowPolicy.class, OverflowPolicy.RELEASE_INLINE);
        long timeoutMs = EnvVars.getLongClamped(env, BridgeEnvKeys.BRIDGE_CALL_TIMEOUT_MS,
            BridgeDefaults.DEFAULT_CALL_TIMEOUT_MS, 0L, BridgeDefaults.MAX_CALL_TIMEOUT_MS);
        int foreignThreads = EnvVars.getIntClamped(env, BridgeEnvKeys.BRIDGE_FOREIGN_THREADS,
            BridgeDefaults.DEFAULT_FOREIGN_THREADS, 1, BridgeDefaults.MAX_FOREIGN_THREADS);
        long metricsInterval = EnvVars.getLongClamped(env, BridgeEnvKeys.BRIDGE_METRICS_LOG_INTERVAL_SEC,
            BridgeDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 0L, 86_400L);
        return new BridgeConfig(capacity, stripes, signalQueue, overflow, Duration.ofMillis(timeoutMs),
            foreignThreads, metricsInterval);
    }

    public BridgeConfig withHandleCapacity(int capacity, int stripes) {
        return new BridgeConfig(capacity, stripes, signalQueueCapacity, signalOverflow, callTimeout, foreignThreads, metricsLogIntervalSec);
    }

    public BridgeConfig withSignalQueue(int capacity, OverflowPolicy overflow) {
        return new BridgeConfig(handleCapacity, handleStripes, capacity, overflow, callTimeout, foreignThreads, metricsLogIntervalSec);
    }

    public BridgeConfig withCallTimeout(Duration timeout) {
        return new BridgeConfig(handleCapacity, handleStripes, signalQueueCapacity, signalOverflow, timeout, foreignThreads, metricsLogIntervalSec);
    }
}
