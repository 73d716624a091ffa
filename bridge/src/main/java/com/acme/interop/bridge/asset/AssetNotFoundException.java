package com.acme.interop.bridge.asset;

import java.io.IOException;

public final class AssetNotFoundException extends IOException {
    private final String assetName;

    public AssetNotFoundException(String assetName) {
        super("Asset not found: " + assetName);
        this.assetName = assetName;
    }

    public AssetNotFoundException(String assetName, Throwable cause) {
        super("Asset not found: " + assetName, cause);
        this.assetName = assetName;
    }

    public String assetName() {
        return assetName;
    }
}
