package com.acme.interop.bridge.handle;

/**
 * Opaque reference to a table slot: {@code index} selects the slot, {@code generation}
 * disambiguates reuse of that slot.
 *
 * <p>Only {@link HandleTable} creates live handles. The raw form packs both halves into one
 * {@code long} so it can cross the boundary as a plain integer.</p>
 */
public record Handle(int index, int generation) {

    public long toRaw() {
        return ((long) index << 32) | (generation & 0xFFFF_FFFFL);
    }

    public static Handle fromRaw(long raw) {
        return new Handle((int) (raw >>> 32), (int) raw);
    }

    @Override
    public String toString() {
        return "Handle[" + index + "@" + generation + "]";
    }
}
