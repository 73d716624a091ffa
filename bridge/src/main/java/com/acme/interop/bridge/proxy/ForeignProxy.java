package com.acme.interop.bridge.proxy;

/**
 * Implemented by every proxy that stands in for an object of the other side.
 */
public interface ForeignProxy {

    /** Raw handle of the proxied object in the other side's table. */
    long foreignHandle();

    String foreignCapability();

    /** {@code true} once the proxy's reference was given back; calls then fail as stale. */
    boolean isReleased();
}
