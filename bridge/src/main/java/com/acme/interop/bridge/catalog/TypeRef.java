package com.acme.interop.bridge.catalog;

import com.acme.interop.bridge.wire.WireType;

import java.util.Objects;

/**
 * Declared type of a parameter or result. References also name the capability the referenced
 * object is expected to implement.
 */
public record TypeRef(WireType type, String capability) {
    public static final TypeRef UNIT = new TypeRef(WireType.UNIT, null);
    public static final TypeRef BOOL = new TypeRef(WireType.BOOL, null);
    public static final TypeRef INT32 = new TypeRef(WireType.INT32, null);
    public static final TypeRef INT64 = new TypeRef(WireType.INT64, null);
    public static final TypeRef FLOAT32 = new TypeRef(WireType.FLOAT32, null);
    public static final TypeRef FLOAT64 = new TypeRef(WireType.FLOAT64, null);
    public static final TypeRef STRING = new TypeRef(WireType.STRING, null);
    public static final TypeRef BYTES = new TypeRef(WireType.BYTES, null);
    public static final TypeRef ERROR = new TypeRef(WireType.ERROR, null);

    private static final String REF_PREFIX = "REF:";

    public TypeRef {
        Objects.requireNonNull(type, "type");
        if (type == WireType.REF) {
            if (capability == null || capability.isBlank()) {
                throw new IllegalArgumentException("REF types must name a capability");
            }
        } else if (capability != null) {
            throw new IllegalArgumentException(type + " cannot name a capability");
        }
    }

    public static TypeRef ref(String capability) {
        return new TypeRef(WireType.REF, capability);
    }

    /**
     * Parses the descriptor notation: a {@link WireType} name, or {@code REF:<capability>}.
     */
    public static TypeRef parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String trimmed = raw.trim();
        if (trimmed.regionMatches(true, 0, REF_PREFIX, 0, REF_PREFIX.length())) {
            return ref(trimmed.substring(REF_PREFIX.length()).trim());
        }
        return new TypeRef(WireType.parse(trimmed), null);
    }

    public String format() {
        return type == WireType.REF ? REF_PREFIX + capability : type.name();
    }

    @Override
    public String toString() {
        return format();
    }
}
