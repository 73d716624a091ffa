package com.acme.interop.bridge.error;

/**
 * Why a cross-boundary operation did not produce a value.
 */
public enum FailureKind {
    /** The handle was released (or never issued); recoverable by the caller. */
    STALE_HANDLE,
    /** Selector or capability does not match the target; a programming error. */
    NO_SUCH_METHOD,
    /** Arguments or result did not fit the declared signature. */
    MARSHALLING,
    /** The callee reported a domain error value. */
    DOMAIN,
    /** The callee failed with an unexpected fault, converted at the dispatch boundary. */
    HOST_FAULT,
    /** The handle table has no free slot. */
    RESOURCE_EXHAUSTED,
    /** A bounded wait expired; the call may still complete later. */
    TIMEOUT,
    /** The call could not be handed to the other side. */
    TRANSPORT,
    /** The waiting thread was interrupted. */
    INTERRUPTED
}
