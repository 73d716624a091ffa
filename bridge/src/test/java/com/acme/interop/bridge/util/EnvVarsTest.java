package com.acme.interop.bridge.util;

import com.acme.interop.bridge.lifecycle.OverflowPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
    }

    @Test
    void shouldParseBooleanWithDefault() {
        Map<String, String> env = Map.of("ENABLED", "true", "DISABLED", "false");
        assertTrue(EnvVars.getBoolean(env, "ENABLED", false));
        assertFalse(EnvVars.getBoolean(env, "DISABLED", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "9000",
            "OK", "42",
            "BAD", "abc"
        );
        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "MISSING", 10, 1, 100));
    }

    @Test
    void shouldClampLongAndAcceptWhitespace() {
        Map<String, String> env = Map.of(
            "LOW", "  -5 ",
            "HIGH", " 99999999999 ",
            "OK", " 250 ",
            "BAD", "1.5"
        );
        assertEquals(0L, EnvVars.getLongClamped(env, "LOW", 7L, 0L, 1_000L));
        assertEquals(1_000L, EnvVars.getLongClamped(env, "HIGH", 7L, 0L, 1_000L));
        assertEquals(250L, EnvVars.getLongClamped(env, "OK", 7L, 0L, 1_000L));
        assertEquals(7L, EnvVars.getLongClamped(env, "BAD", 7L, 0L, 1_000L));
    }

    @Test
    void shouldParseEnumCaseInsensitively() {
        Map<String, String> env = Map.of("POLICY", " drop_oldest ", "BAD", "sometimes");
        assertEquals(OverflowPolicy.DROP_OLDEST,
            EnvVars.getEnum(env, "POLICY", OverflowPolicy.class, OverflowPolicy.RELEASE_INLINE));
        assertEquals(OverflowPolicy.RELEASE_INLINE,
            EnvVars.getEnum(env, "BAD", OverflowPolicy.class, OverflowPolicy.RELEASE_INLINE));
        assertEquals(OverflowPolicy.RELEASE_INLINE,
            EnvVars.getEnum(env, "MISSING", OverflowPolicy.class, OverflowPolicy.RELEASE_INLINE));
    }
}
