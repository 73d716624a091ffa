package com.acme.interop.bridge.handle;

/**
 * Something that can drop one reference held through a raw handle value.
 */
@FunctionalInterface
public interface ReleaseSink {
    ReleaseResult release(long rawHandle);
}
