package com.acme.interop.bridge.asset;

import java.io.IOException;

/**
 * Synchronous byte-oriented resource lookup.
 */
@FunctionalInterface
public interface AssetSource {

    /**
     * @throws AssetNotFoundException if no asset has this name
     * @throws IOException if the asset exists but cannot be read
     */
    byte[] open(String name) throws IOException;
}
