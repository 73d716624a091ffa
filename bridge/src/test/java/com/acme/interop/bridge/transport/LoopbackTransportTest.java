package com.acme.interop.bridge.transport;

import com.acme.interop.bridge.call.CallDirection;
import com.acme.interop.bridge.call.CallOutcome;
import com.acme.interop.bridge.call.HostEndpoint;
import com.acme.interop.bridge.call.PendingCall;
import com.acme.interop.bridge.catalog.Selector;
import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;
import com.acme.interop.bridge.handle.ReleaseResult;
import com.acme.interop.bridge.wire.WireValue;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoopbackTransportTest {
    private static final Selector SELECTOR = Selector.of("I2", 0);

    @Test
    void shouldRunTopLevelCallsOnExecutorAndNestedCallsInline() throws Exception {
        EventExecutorGroup group = new DefaultEventExecutorGroup(2, new DefaultThreadFactory("loopback-test", true));
        try {
            LoopbackLink link = new LoopbackLink();
            LoopbackTransport transport = new LoopbackTransport("test", link, LoopbackTransport.Mode.EXECUTOR, group);
            RecordingEndpoint endpoint = new RecordingEndpoint();
            transport.connect(endpoint);
            endpoint.nested = transport;

            PendingCall call = newCall(1L);
            transport.send(call);
            CallOutcome outcome = call.await(Duration.ofSeconds(20));

            assertInstanceOf(CallOutcome.Returned.class, outcome);
            assertEquals(2, endpoint.threads.size());
            assertEquals(endpoint.threads.get(0), endpoint.threads.get(1));
            assertNotEquals(Thread.currentThread().getName(), endpoint.threads.get(0));
            assertTrue(endpoint.threads.get(0).startsWith("loopback-test"));
        } finally {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5_000);
        }
    }

    @Test
    void shouldRefuseCallsWhenUnconnectedOrClosed() {
        LoopbackTransport transport = new LoopbackTransport("inline", new LoopbackLink(), LoopbackTransport.Mode.INLINE, null);

        BridgeException unconnected = assertThrows(BridgeException.class, () -> transport.send(newCall(1L)));
        assertEquals(FailureKind.TRANSPORT, unconnected.kind());
        assertEquals(ReleaseResult.STALE, transport.release(1L));

        transport.connect(new RecordingEndpoint());
        transport.close();
        assertTrue(transport.isClosed());
        assertThrows(BridgeException.class, () -> transport.send(newCall(1L)));
    }

    @Test
    void shouldConvertEndpointFailureToTransportOutcome() {
        LoopbackTransport transport = new LoopbackTransport("inline", new LoopbackLink(), LoopbackTransport.Mode.INLINE, null);
        RecordingEndpoint endpoint = new RecordingEndpoint();
        endpoint.explode = true;
        transport.connect(endpoint);

        PendingCall call = newCall(1L);
        transport.send(call);

        CallOutcome.Failed failed = assertInstanceOf(CallOutcome.Failed.class, call.await(Duration.ofSeconds(1)));
        assertEquals(FailureKind.TRANSPORT, failed.kind());
    }

    @Test
    void shouldCompleteCallAsHostFaultWhenEndpointThrowsError() {
        EventExecutorGroup group = new DefaultEventExecutorGroup(1, new DefaultThreadFactory("loopback-fault", true));
        try {
            LoopbackTransport transport = new LoopbackTransport("test", new LoopbackLink(), LoopbackTransport.Mode.EXECUTOR, group);
            RecordingEndpoint endpoint = new RecordingEndpoint();
            endpoint.fault = new Error("custom fault");
            transport.connect(endpoint);

            PendingCall call = newCall(1L);
            transport.send(call);

            CallOutcome.Failed failed = assertInstanceOf(CallOutcome.Failed.class, call.await(Duration.ofSeconds(20)));
            assertEquals(FailureKind.HOST_FAULT, failed.kind());
            assertEquals("custom fault", failed.error().message());
        } finally {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5_000);
        }
    }

    private static PendingCall newCall(long handle) {
        PendingCall call = new PendingCall(CallDirection.HOST_TO_FOREIGN, handle, SELECTOR, List.of());
        call.markSent();
        return call;
    }

    private static final class RecordingEndpoint implements HostEndpoint {
        private final List<String> threads = Collections.synchronizedList(new ArrayList<>());
        private volatile LoopbackTransport nested;
        private volatile boolean explode;
        private volatile Error fault;

        @Override
        public CallOutcome invokeHost(long handle, Selector selector, List<WireValue> args) {
            if (explode) {
                throw new IllegalStateException("endpoint failure");
            }
            Error error = fault;
            if (error != null) {
                throw error;
            }
            threads.add(Thread.currentThread().getName());
            LoopbackTransport transport = nested;
            if (transport != null && handle == 1L) {
                PendingCall inner = newCall(2L);
                transport.send(inner);
                if (!(inner.await(Duration.ofSeconds(5)) instanceof CallOutcome.Returned)) {
                    throw new IllegalStateException("nested call failed");
                }
            }
            return CallOutcome.returned(WireValue.UNIT);
        }

        @Override
        public ReleaseResult release(long handle) {
            return ReleaseResult.RELEASED;
        }
    }
}
