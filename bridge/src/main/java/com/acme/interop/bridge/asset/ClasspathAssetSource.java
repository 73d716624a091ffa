package com.acme.interop.bridge.asset;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads assets from class-path resources under a fixed prefix.
 */
public final class ClasspathAssetSource implements AssetSource {
    private final ClassLoader loader;
    private final String prefix;

    public ClasspathAssetSource(ClassLoader loader, String prefix) {
        this.loader = Objects.requireNonNull(loader, "loader");
        String p = Objects.requireNonNull(prefix, "prefix");
        this.prefix = p.isEmpty() || p.endsWith("/") ? p : p + "/";
    }

    @Override
    public byte[] open(String name) throws IOException {
        Objects.requireNonNull(name, "name");
        if (name.startsWith("/") || name.contains("..")) {
            throw new AssetNotFoundException(name);
        }
        try (InputStream in = loader.getResourceAsStream(prefix + name)) {
            if (in == null) {
                throw new AssetNotFoundException(name);
            }
            return in.readAllBytes();
        }
    }
}
