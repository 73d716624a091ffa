package com.acme.interop.bridge;

import com.acme.interop.bridge.lifecycle.OverflowPolicy;
import com.acme.interop.bridge.util.BridgeDefaults;
import com.acme.interop.bridge.util.BridgeEnvKeys;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BridgeConfigTest {

    @Test
    void shouldUseDefaultsWhenEnvironmentIsEmpty() {
        BridgeConfig config = BridgeConfig.defaults();

        assertEquals(BridgeDefaults.DEFAULT_HANDLE_CAPACITY, config.handleCapacity());
        assertEquals(BridgeDefaults.DEFAULT_HANDLE_STRIPES, config.handleStripes());
        assertEquals(BridgeDefaults.DEFAULT_SIGNAL_QUEUE_CAPACITY, config.signalQueueCapacity());
        assertEquals(OverflowPolicy.RELEASE_INLINE, config.signalOverflow());
        assertEquals(Duration.ZERO, config.callTimeout());
        assertEquals(BridgeDefaults.DEFAULT_FOREIGN_THREADS, config.foreignThreads());
        assertEquals(0L, config.metricsLogIntervalSec());
    }

    @Test
    void shouldReadAndClampEnvironment() {
        BridgeConfig config = BridgeConfig.fromEnv(Map.of(
            BridgeEnvKeys.BRIDGE_HANDLE_CAPACITY, "4096",
            BridgeEnvKeys.BRIDGE_HANDLE_STRIPES, "8",
            BridgeEnvKeys.BRIDGE_SIGNAL_QUEUE_CAPACITY, "-3",
            BridgeEnvKeys.BRIDGE_SIGNAL_OVERFLOW, "drop_oldest",
            BridgeEnvKeys.BRIDGE_CALL_TIMEOUT_MS, "1500",
            BridgeEnvKeys.BRIDGE_FOREIGN_THREADS, "100000",
            BridgeEnvKeys.BRIDGE_METRICS_LOG_INTERVAL_SEC, "oops"
        ));

        assertEquals(4096, config.handleCapacity());
        assertEquals(8, config.handleStripes());
        assertEquals(1, config.signalQueueCapacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.signalOverflow());
        assertEquals(Duration.ofMillis(1500), config.callTimeout());
        assertEquals(BridgeDefaults.MAX_FOREIGN_THREADS, config.foreignThreads());
        assertEquals(BridgeDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, config.metricsLogIntervalSec());
    }

    @Test
    void shouldRejectInconsistentGeometry() {
        BridgeConfig defaults = BridgeConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withHandleCapacity(64, 3));
        assertThrows(IllegalArgumentException.class, () -> defaults.withHandleCapacity(2, 4));
        assertThrows(IllegalArgumentException.class, () -> defaults.withSignalQueue(0, OverflowPolicy.DROP_OLDEST));
        assertThrows(IllegalArgumentException.class, () -> defaults.withCallTimeout(Duration.ofMillis(-1)));
    }

    @Test
    void shouldCopyWithOverrides() {
        BridgeConfig config = BridgeConfig.defaults()
            .withHandleCapacity(16, 2)
            .withSignalQueue(8, OverflowPolicy.DROP_OLDEST)
            .withCallTimeout(Duration.ofSeconds(2));

        assertEquals(16, config.handleCapacity());
        assertEquals(2, config.handleStripes());
        assertEquals(8, config.signalQueueCapacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.signalOverflow());
        assertEquals(Duration.ofSeconds(2), config.callTimeout());
    }
}
