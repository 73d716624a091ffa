package com.acme.interop.bridge.catalog;

import java.util.Objects;

/**
 * Addresses a method of a capability either by ordinal or by name.
 */
public record Selector(String capability, int ordinal, String method) {

    public Selector {
        Objects.requireNonNull(capability, "capability");
        if (ordinal < 0 && method == null) {
            throw new IllegalArgumentException("Selector needs an ordinal or a method name");
        }
    }

    public static Selector of(String capability, int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0, got " + ordinal);
        }
        return new Selector(capability, ordinal, null);
    }

    public static Selector named(String capability, String method) {
        return new Selector(capability, -1, Objects.requireNonNull(method, "method"));
    }

    public static Selector of(String capability, MethodSignature signature) {
        return new Selector(capability, signature.selector(), signature.name());
    }

    public boolean byOrdinal() {
        return ordinal >= 0;
    }

    @Override
    public String toString() {
        return capability + "#" + (byOrdinal() ? String.valueOf(ordinal) : method);
    }
}
