package com.acme.interop.bridge.error;

import java.util.Objects;

/**
 * Host-side view of an error produced on the other side of the boundary.
 *
 * <p>{@link #getMessage()} returns the foreign message unchanged, including the empty string.</p>
 */
public final class ForeignException extends BridgeException {
    private final transient ForeignError error;

    public ForeignException(ForeignError error) {
        this(FailureKind.DOMAIN, error);
    }

    public ForeignException(FailureKind kind, ForeignError error) {
        super(kind, Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ForeignError error() {
        return error;
    }

    public String foreignType() {
        return error.type();
    }

    @Override
    public String toString() {
        return "ForeignException[" + error.type() + "]: " + error.message();
    }
}
