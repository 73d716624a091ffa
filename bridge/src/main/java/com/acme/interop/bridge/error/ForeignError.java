package com.acme.interop.bridge.error;

import java.util.Objects;

/**
 * Error value in the form both sides understand.
 *
 * <p>{@code message} may be empty; an error with an empty message is still an error.
 * The absence of an error is represented by {@code null}, never by an instance.</p>
 */
public record ForeignError(String type, String message) {
    public static final String GENERIC_TYPE = "error";

    public ForeignError {
        Objects.requireNonNull(type, "type");
    }

    public static ForeignError of(String message) {
        return new ForeignError(GENERIC_TYPE, message);
    }
}
