package com.acme.interop.bridge.telemetry;

import com.acme.interop.bridge.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs one JSON line of bridge counters per interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicBridgeMetrics metrics;
    private final String side;
    private final Supplier<Map<String, Long>> additionalCountersSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicBridgeMetrics metrics, String side, long intervalSeconds) {
        this(metrics, side, intervalSeconds, () -> Map.of());
    }

    public PeriodicMetricsReporter(AtomicBridgeMetrics metrics,
                                   String side,
                                   long intervalSeconds,
                                   Supplier<Map<String, Long>> additionalCountersSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.side = Objects.requireNonNull(side, "side");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.additionalCountersSupplier = additionalCountersSupplier == null ? (() -> Map.of()) : additionalCountersSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bridge-metrics-reporter-" + side.toLowerCase(Locale.ROOT));
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicBridgeMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "object-bridge");
        payload.put("type", "bridge_metrics");
        payload.put("side", side);
        payload.put("outboundCalls", s.outboundCalls());
        payload.put("inboundCalls", s.inboundCalls());
        payload.put("callNanosTotal", s.callNanosTotal());
        payload.put("callSamples", s.callSamples());
        payload.put("callP99Nanos", s.callP99Nanos());
        payload.put("signalsEmitted", s.signalsEmitted());
        payload.put("signalsDropped", s.signalsDropped());
        payload.put("signalsDrained", s.signalsDrained());
        payload.put("threadAttachments", s.threadAttachments());
        payload.put("liveHandles", s.liveHandles());
        payload.put("failuresByKind", s.failuresByKind());
        Map<String, Long> extra = additionalCountersSupplier.get();
        if (extra != null && !extra.isEmpty()) {
            payload.put("extraCounters", extra);
        }
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Metrics reporter failure: " + t.getClass().getSimpleName(), t);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
