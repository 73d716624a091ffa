package com.acme.interop.bridge.asset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads assets from files below a root directory. Names that resolve outside the root are
 * reported as not found.
 */
public final class FileSystemAssetSource implements AssetSource {
    private final Path root;

    public FileSystemAssetSource(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public byte[] open(String name) throws IOException {
        Objects.requireNonNull(name, "name");
        Path resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root) || !Files.isRegularFile(resolved)) {
            throw new AssetNotFoundException(name);
        }
        try {
            return Files.readAllBytes(resolved);
        } catch (NoSuchFileException e) {
            throw new AssetNotFoundException(name, e);
        }
    }
}
