package com.khaounen.gatewaypolicy.security.policy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed view over the schema-less {@code result} object returned by the policy engine.
 * Absent or mistyped keys read as {@code false}, {@code ""} or {@code 0}.
 */
public final class PolicyResult {

    private final Map<String, Object> values;

    private PolicyResult(Map<String, Object> values) {
        this.values = values;
    }

    public static PolicyResult of(Map<String, Object> result) {
        return new PolicyResult(result == null ? Map.of() : result);
    }

    public static PolicyResult empty() {
        return new PolicyResult(Map.of());
    }

    public boolean getBoolean(String key) {
        return values.get(key) instanceof Boolean value && value;
    }

    public String getString(String key) {
        return values.get(key) instanceof String value ? value : "";
    }

    /**
     * Integer and floating-point encodings of the same value read alike; values outside the
     * int range clamp to its bounds.
     */
    public int getInt(String key) {
        long value = getLong(key);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    public long getLong(String key) {
        if (!(values.get(key) instanceof Number value)) {
            return 0;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        if (value instanceof BigInteger big) {
            if (big.bitLength() < 64) {
                return big.longValue();
            }
            return big.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        // (long) saturates at the long bounds and truncates toward zero
        return (long) value.doubleValue();
    }

    public boolean isMissing(String key, Class<?> expectedType) {
        return !expectedType.isInstance(values.get(key));
    }

    public List<String> missingKeys(Map<String, Class<?>> expected) {
        List<String> missing = new ArrayList<>();
        expected.forEach((key, type) -> {
            if (isMissing(key, type)) {
                missing.add(key);
            }
        });
        return missing;
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
