package com.acme.interop.bridge.wire;

import java.util.Locale;

public enum WireType {
    UNIT,
    BOOL,
    INT32,
    INT64,
    FLOAT32,
    FLOAT64,
    STRING,
    BYTES,
    REF,
    ERROR;

    public static WireType parse(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
