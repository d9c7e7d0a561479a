package com.khaounen.gatewaypolicy.security.policy;

import java.util.Map;

public record PolicyDecision(
        boolean allow,
        String reason,
        String policyId,
        Map<String, Object> metadata
) {

    public static final String DEGRADED = "degraded";
    public static final String MISSING_KEYS = "missing_keys";

    public PolicyDecision {
        reason = reason == null ? "" : reason;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PolicyDecision allow(DecisionReason reason) {
        return new PolicyDecision(true, reason.text(), null, null);
    }

    public static PolicyDecision deny(DecisionReason reason) {
        return new PolicyDecision(false, reason.text(), null, null);
    }

    public boolean degraded() {
        return Boolean.TRUE.equals(metadata.get(DEGRADED));
    }

    public boolean hasReason(DecisionReason expected) {
        return expected.text().equals(reason);
    }
}
