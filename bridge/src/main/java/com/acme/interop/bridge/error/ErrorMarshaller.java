package com.acme.interop.bridge.error;

/**
 * Converts host exceptions to {@link ForeignError} values and back.
 *
 * <p>{@code null} maps to {@code null} in both directions and stands for "no error".</p>
 */
public final class ErrorMarshaller {
    public static final ErrorMarshaller INSTANCE = new ErrorMarshaller();

    private ErrorMarshaller() {
    }

    public ForeignError toForeign(Throwable error) {
        if (error == null) {
            return null;
        }
        if (error instanceof ForeignException foreign) {
            return foreign.error();
        }
        return new ForeignError(error.getClass().getName(), error.getMessage());
    }

    public ForeignException toHost(ForeignError error) {
        if (error == null) {
            return null;
        }
        return new ForeignException(error);
    }

    public ForeignException toHost(FailureKind kind, ForeignError error) {
        if (error == null) {
            return null;
        }
        return new ForeignException(kind, error);
    }
}
