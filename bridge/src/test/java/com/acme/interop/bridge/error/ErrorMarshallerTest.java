package com.acme.interop.bridge.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ErrorMarshallerTest {
    private final ErrorMarshaller marshaller = ErrorMarshaller.INSTANCE;

    @Test
    void shouldPreserveMessageAcrossRoundTrip() {
        ForeignError foreign = marshaller.toForeign(new IllegalStateException("disk full"));
        ForeignException back = marshaller.toHost(foreign);

        assertEquals(IllegalStateException.class.getName(), foreign.type());
        assertEquals("disk full", back.getMessage());
        assertEquals(FailureKind.DOMAIN, back.kind());
        assertEquals(IllegalStateException.class.getName(), back.foreignType());
    }

    @Test
    void shouldKeepEmptyMessageAsNonNullError() {
        ForeignError foreign = marshaller.toForeign(new Exception(""));
        ForeignException back = marshaller.toHost(foreign);

        assertNotNull(foreign);
        assertEquals("", foreign.message());
        assertNotNull(back);
        assertEquals("", back.getMessage());
    }

    @Test
    void shouldMapNullToNoErrorBothWays() {
        assertNull(marshaller.toForeign(null));
        assertNull(marshaller.toHost(null));
        assertNull(marshaller.toHost(FailureKind.HOST_FAULT, null));
    }

    @Test
    void shouldUnwrapForeignExceptionToOriginalError() {
        ForeignError original = new ForeignError("custom.Type", "boom");
        ForeignException wrapped = new ForeignException(original);

        assertSame(original, marshaller.toForeign(wrapped));
    }

    @Test
    void shouldCarryFailureKindForFaults() {
        ForeignException fault = marshaller.toHost(FailureKind.HOST_FAULT, ForeignError.of("npe"));
        assertEquals(FailureKind.HOST_FAULT, fault.kind());
        assertEquals(ForeignError.GENERIC_TYPE, fault.foreignType());
        assertEquals("npe", fault.getMessage());
    }

    @Test
    void shouldAllowNullMessage() {
        ForeignError foreign = marshaller.toForeign(new RuntimeException());
        assertNotNull(foreign);
        assertNull(foreign.message());
    }
}
