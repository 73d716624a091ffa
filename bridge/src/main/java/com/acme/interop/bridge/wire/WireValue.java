package com.acme.interop.bridge.wire;

import com.acme.interop.bridge.error.ForeignError;

import java.util.Arrays;
import java.util.Objects;

/**
 * Marshalled argument or result. Primitives travel by value, objects as {@link WireRef}s,
 * errors as {@link ForeignError} values.
 */
public sealed interface WireValue permits WireValue.Unit, WireValue.Bool, WireValue.Int32, WireValue.Int64,
    WireValue.Float32, WireValue.Float64, WireValue.Str, WireValue.Bytes, WireValue.Ref, WireValue.Err {

    Unit UNIT = new Unit();

    WireType type();

    record Unit() implements WireValue {
        @Override
        public WireType type() {
            return WireType.UNIT;
        }
    }

    record Bool(boolean value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.BOOL;
        }
    }

    record Int32(int value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.INT32;
        }
    }

    record Int64(long value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.INT64;
        }
    }

    record Float32(float value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.FLOAT32;
        }
    }

    record Float64(double value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.FLOAT64;
        }
    }

    record Str(String value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.STRING;
        }
    }

    /** {@code value} may be {@code null} for an absent byte sequence. */
    record Bytes(byte[] value) implements WireValue {
        @Override
        public WireType type() {
            return WireType.BYTES;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[" + (value == null ? "null" : value.length + " bytes") + "]";
        }
    }

    record Ref(WireRef ref) implements WireValue {
        public Ref {
            Objects.requireNonNull(ref, "ref");
        }

        @Override
        public WireType type() {
            return WireType.REF;
        }
    }

    /** {@code error} is {@code null} when there is no error. */
    record Err(ForeignError error) implements WireValue {
        @Override
        public WireType type() {
            return WireType.ERROR;
        }
    }
}
