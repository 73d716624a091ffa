package com.acme.interop.bridge.call;

import com.acme.interop.bridge.error.FailureKind;
import com.acme.interop.bridge.error.ForeignError;
import com.acme.interop.bridge.wire.WireValue;

import java.util.Objects;

/**
 * What a cross-boundary call produced. Failures are values; nothing is thrown across the boundary.
 */
public sealed interface CallOutcome permits CallOutcome.Returned, CallOutcome.Failed {

    static Returned returned(WireValue value) {
        return new Returned(value);
    }

    static Failed failed(FailureKind kind, ForeignError error) {
        return new Failed(kind, error);
    }

    static Failed failed(FailureKind kind, String message) {
        return new Failed(kind, new ForeignError(kind.name(), message));
    }

    record Returned(WireValue value) implements CallOutcome {
        public Returned {
            Objects.requireNonNull(value, "value");
        }
    }

    /** {@code error} is never {@code null}: a failed call always carries an error value. */
    record Failed(FailureKind kind, ForeignError error) implements CallOutcome {
        public Failed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(error, "error");
        }
    }
}
