package com.khaounen.gatewaypolicy.security.policy;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyResultTest {

    @Test
    void readsWellTypedValues() {
        PolicyResult result = PolicyResult.of(Map.of(
                "allow", true,
                "reason", "ok",
                "requests_per_window", 100
        ));

        assertTrue(result.getBoolean("allow"));
        assertEquals("ok", result.getString("reason"));
        assertEquals(100, result.getInt("requests_per_window"));
    }

    @Test
    void absentKeysReadAsDefaults() {
        PolicyResult result = PolicyResult.empty();

        assertFalse(result.getBoolean("allow"));
        assertEquals("", result.getString("reason"));
        assertEquals(0, result.getInt("requests_per_window"));
    }

    @Test
    void nullResultMapIsEmpty() {
        PolicyResult result = PolicyResult.of(null);

        assertFalse(result.getBoolean("allow"));
        assertTrue(result.asMap().isEmpty());
    }

    @Test
    void mistypedValuesReadAsDefaults() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("allow", "true");
        raw.put("reason", 42);
        raw.put("requests_per_window", "100");
        raw.put("time_window_seconds", null);
        PolicyResult result = PolicyResult.of(raw);

        assertFalse(result.getBoolean("allow"));
        assertEquals("", result.getString("reason"));
        assertEquals(0, result.getInt("requests_per_window"));
        assertEquals(0, result.getInt("time_window_seconds"));
    }

    @Test
    void acceptsIntegerAndFloatingPointNumbers() {
        PolicyResult result = PolicyResult.of(Map.of(
                "a", 60,
                "b", 60.0d,
                "c", 90L,
                "d", 59.9d,
                "e", new BigDecimal("1000")
        ));

        assertEquals(60, result.getInt("a"));
        assertEquals(60, result.getInt("b"));
        assertEquals(90, result.getInt("c"));
        assertEquals(59, result.getInt("d"));
        assertEquals(1000, result.getInt("e"));
    }

    @Test
    void outOfRangeNumbersClampWhateverTheirEncoding() {
        PolicyResult result = PolicyResult.of(Map.of(
                "long", 3000000000L,
                "double", 3.0E9d,
                "big", new BigInteger("3000000000"),
                "decimal", new BigDecimal("3000000000.5"),
                "negative", -3000000000L,
                "huge", new BigInteger("99999999999999999999999")
        ));

        assertEquals(Integer.MAX_VALUE, result.getInt("long"));
        assertEquals(Integer.MAX_VALUE, result.getInt("double"));
        assertEquals(Integer.MAX_VALUE, result.getInt("big"));
        assertEquals(Integer.MAX_VALUE, result.getInt("decimal"));
        assertEquals(Integer.MIN_VALUE, result.getInt("negative"));
        assertEquals(Integer.MAX_VALUE, result.getInt("huge"));
        assertEquals(Long.MAX_VALUE, result.getLong("huge"));
    }

    @Test
    void readsLongsBeyondIntRange() {
        PolicyResult result = PolicyResult.of(Map.of("window", 4294967356L, "fraction", 90.7d));

        assertEquals(4294967356L, result.getLong("window"));
        assertEquals(90L, result.getLong("fraction"));
        assertEquals(0L, result.getLong("absent"));
    }

    @Test
    void reportsMissingAndMistypedKeysInOrder() {
        Map<String, Class<?>> expected = new LinkedHashMap<>();
        expected.put("allow", Boolean.class);
        expected.put("reason", String.class);
        PolicyResult result = PolicyResult.of(Map.of("allow", "yes"));

        assertEquals(List.of("allow", "reason"), result.missingKeys(expected));
        assertTrue(PolicyResult.of(Map.of("allow", false, "reason", "x")).missingKeys(expected).isEmpty());
    }
}
