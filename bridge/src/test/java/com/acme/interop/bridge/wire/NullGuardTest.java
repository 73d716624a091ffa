package com.acme.interop.bridge.wire;

import com.acme.interop.bridge.handle.Handle;
import com.acme.interop.bridge.handle.HandleTable;
import com.acme.interop.bridge.handle.StaleHandleException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NullGuardTest {

    @Test
    void shouldEncodeNullAsSentinelWithoutTouchingTable() {
        HandleTable table = new HandleTable(16, 1);
        NullGuard guard = new NullGuard(Side.HOST, table);
        AtomicInteger liveCalls = new AtomicInteger();

        WireRef encoded = guard.encode(null, object -> {
            liveCalls.incrementAndGet();
            return guard.owned(table.register(object));
        });

        assertSame(WireRef.NULL, encoded);
        assertTrue(encoded.isNull());
        assertNull(guard.decode(encoded));
        assertEquals(0, liveCalls.get());
        assertEquals(0, table.stats().registerCount());
        assertEquals(0, table.stats().staleReleaseCount());
    }

    @Test
    void shouldDecodeSentinelToNullEvenAfterSlotZeroIsReused() {
        HandleTable table = new HandleTable(1, 1);
        NullGuard guard = new NullGuard(Side.HOST, table);
        for (int i = 0; i < 5; i++) {
            table.release(table.register("churn" + i));
        }
        WireRef live = guard.encode("live", object -> guard.owned(table.register(object)));

        assertNull(guard.decode(WireRef.NULL));
        assertNotEquals(WireRef.NULL, live);
        assertEquals("live", guard.decode(live));
    }

    @Test
    void shouldHandLiveReferencesToTheDecodeStrategy() {
        NullGuard guard = new NullGuard(Side.HOST, new HandleTable(16, 1));
        WireRef peer = WireRef.of(Side.FOREIGN, 42L);

        assertEquals("proxy:42", guard.decode(peer, ref -> "proxy:" + ref.raw()));
        assertNull(guard.decode(WireRef.NULL, ref -> "never"));
    }

    @Test
    void shouldRefuseLiveObjectEncodedAsSentinel() {
        NullGuard guard = new NullGuard(Side.FOREIGN, new HandleTable(16, 1));
        assertThrows(IllegalStateException.class, () -> guard.encode("anything", object -> WireRef.NULL));
    }

    @Test
    void shouldTagOwnedReferencesWithThisSide() {
        HandleTable table = new HandleTable(16, 1);
        NullGuard guard = new NullGuard(Side.FOREIGN, table);
        Handle handle = table.register("registered");

        WireRef ref = guard.owned(handle);

        assertEquals(Side.FOREIGN, ref.owner());
        assertEquals(handle.toRaw(), ref.raw());
    }

    @Test
    void shouldRejectReferencesOwnedByTheOtherSide() {
        NullGuard guard = new NullGuard(Side.HOST, new HandleTable(16, 1));
        assertThrows(IllegalArgumentException.class, () -> guard.decode(WireRef.of(Side.FOREIGN, 42L)));
    }

    @Test
    void shouldReportStaleReferences() {
        HandleTable table = new HandleTable(16, 1);
        NullGuard guard = new NullGuard(Side.HOST, table);
        WireRef ref = guard.owned(table.register("gone"));
        table.release(ref.raw());
        assertThrows(StaleHandleException.class, () -> guard.decode(ref));
    }

    @Test
    void shouldReserveNoneOwnerForSentinel() {
        assertThrows(IllegalArgumentException.class, () -> new WireRef(Side.NONE, 0L));
        assertThrows(IllegalArgumentException.class, () -> new WireRef(Side.HOST, WireRef.NULL_RAW));
        assertThrows(IllegalArgumentException.class, () -> WireRef.of(Side.NONE, 5L));
        assertThrows(IllegalArgumentException.class, () -> new NullGuard(Side.NONE, new HandleTable(16, 1)));
    }
}
