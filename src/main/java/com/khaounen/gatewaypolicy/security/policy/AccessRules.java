package com.khaounen.gatewaypolicy.security.policy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference encoding of the gateway access and rate-limit rules. The rules loaded into the
 * policy engine must agree with these; rules are checked in declaration order.
 */
public final class AccessRules {

    public static final String ADMIN_PREFIX = "/admin/";
    public static final String PUBLIC_PREFIX = "/api/v1/public/";
    public static final List<String> PROTECTED_SEGMENTS = List.of("/patients", "/appointments");

    public static final int DEFAULT_ADMIN_RATE_LIMIT = 100;
    public static final int DEFAULT_PUBLIC_RATE_LIMIT = 1000;
    public static final Duration DEFAULT_TIME_WINDOW = Duration.ofSeconds(60);

    private AccessRules() {
    }

    public static PolicyDecision decide(PolicyRequest request) {
        Optional<Gateway> gateway = Gateway.fromId(request.gateway());
        if (gateway.isEmpty()) {
            return PolicyDecision.deny(DecisionReason.NO_MATCHING_POLICY);
        }
        String resource = request.resource();
        if (gateway.get() == Gateway.ADMIN && resource.startsWith(ADMIN_PREFIX)) {
            if (Role.ADMIN.isIn(request.roles())) {
                return PolicyDecision.allow(DecisionReason.ADMIN_ROLE_PERMITS);
            }
            if (Role.USER.isIn(request.roles())) {
                return PolicyDecision.deny(DecisionReason.INSUFFICIENT_PERMISSIONS);
            }
            if (request.anonymous()) {
                return PolicyDecision.deny(DecisionReason.AUTHENTICATION_REQUIRED);
            }
        }
        if (gateway.get() == Gateway.PUBLIC) {
            if (resource.startsWith(PUBLIC_PREFIX)) {
                return PolicyDecision.allow(DecisionReason.PUBLIC_ENDPOINT);
            }
            if (request.anonymous() && referencesProtectedResource(resource)) {
                return PolicyDecision.deny(DecisionReason.AUTHENTICATION_REQUIRED);
            }
        }
        return PolicyDecision.deny(DecisionReason.NO_MATCHING_POLICY);
    }

    /** Empty for gateways without a rate-limit policy. */
    public static Optional<RateLimits> limitsFor(String gateway) {
        return Gateway.fromId(gateway).map(AccessRules::limitsFor);
    }

    public static RateLimits limitsFor(Gateway gateway) {
        Objects.requireNonNull(gateway, "gateway");
        if (gateway == Gateway.ADMIN) {
            return RateLimits.of(DEFAULT_ADMIN_RATE_LIMIT, DEFAULT_TIME_WINDOW);
        }
        return RateLimits.of(DEFAULT_PUBLIC_RATE_LIMIT, DEFAULT_TIME_WINDOW);
    }

    private static boolean referencesProtectedResource(String resource) {
        for (String segment : PROTECTED_SEGMENTS) {
            if (resource.contains(segment)) {
                return true;
            }
        }
        return false;
    }
}
