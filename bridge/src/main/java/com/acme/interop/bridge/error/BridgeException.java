package com.acme.interop.bridge.error;

import java.util.Objects;

/**
 * Base class for bridge failures surfaced to host code.
 */
public class BridgeException extends RuntimeException {
    private final FailureKind kind;

    public BridgeException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public BridgeException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }
}
