package com.acme.interop.bridge.asset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default and monospace system fonts. The Noto face is preferred; the deprecated Droid face is
 * the fallback. When neither exists the Noto failure is reported.
 */
public final class FontAssets {
    private static final Logger LOG = Logger.getLogger(FontAssets.class.getName());

    public static final String NOTO_SANS = "noto/NotoSans-Regular.ttf";
    public static final String DROID_SANS = "droid/DroidSans.ttf";
    public static final String NOTO_MONO = "noto/NotoMono-Regular.ttf";
    public static final String DROID_SANS_MONO = "droid/DroidSansMono.ttf";

    private final AssetSource source;

    public FontAssets(AssetSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /** Fonts installed under {@code /usr/share/fonts/truetype}. */
    public static FontAssets system() {
        return new FontAssets(new FileSystemAssetSource(Path.of("/usr/share/fonts/truetype")));
    }

    public byte[] defaultFont() throws IOException {
        return preferred(NOTO_SANS, DROID_SANS);
    }

    public byte[] monospaceFont() throws IOException {
        return preferred(NOTO_MONO, DROID_SANS_MONO);
    }

    private byte[] preferred(String primary, String fallback) throws IOException {
        try {
            return source.open(primary);
        } catch (IOException primaryFailure) {
            try {
                byte[] bytes = source.open(fallback);
                LOG.fine(() -> "Using fallback font " + fallback + " instead of " + primary);
                return bytes;
            } catch (IOException fallbackFailure) {
                primaryFailure.addSuppressed(fallbackFailure);
                throw primaryFailure;
            }
        }
    }
}
