package com.acme.interop.bridge.lifecycle;

/**
 * One-shot notice that the object watched for {@code rawHandle} is gone.
 */
public record CollectionSignal(long rawHandle, long emittedNanos) {}
