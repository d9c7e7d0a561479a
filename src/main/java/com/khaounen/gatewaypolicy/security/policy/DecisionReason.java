package com.khaounen.gatewaypolicy.security.policy;

/**
 * Reasons attached to decisions produced inside this library. Decisions returned by the
 * policy engine carry whatever reason the loaded policy emits.
 */
public enum DecisionReason {
    ADMIN_ROLE_PERMITS("admin role permits all admin operations"),
    INSUFFICIENT_PERMISSIONS("insufficient permissions"),
    AUTHENTICATION_REQUIRED("authentication required"),
    PUBLIC_ENDPOINT("public endpoint allows anonymous access"),
    UNKNOWN_GATEWAY("unknown gateway"),
    POLICY_EVALUATION_ERROR("policy evaluation error"),
    NO_MATCHING_POLICY("no matching policy");

    private final String text;

    DecisionReason(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
