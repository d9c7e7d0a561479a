package com.khaounen.gatewaypolicy.security.policy;

import java.util.Objects;

import static com.khaounen.gatewaypolicy.security.policy.PolicyEvaluationException.Kind.CONFIGURATION;

public final class PolicyPaths {

    public static final String ADMIN_RBAC = "authz/admin_gateway/rbac";
    public static final String ADMIN_RATE_LIMITS = "authz/admin_gateway/rate_limits";
    public static final String PUBLIC_ANONYMOUS = "authz/public_gateway/anonymous";
    public static final String PUBLIC_RATE_LIMITS = "authz/public_gateway/rate_limits";

    private PolicyPaths() {
    }

    public static String resolve(Gateway gateway, PolicyCategory category) {
        Objects.requireNonNull(gateway, "gateway");
        Objects.requireNonNull(category, "category");
        boolean access = category == PolicyCategory.ACCESS;
        if (gateway == Gateway.ADMIN) {
            return access ? ADMIN_RBAC : ADMIN_RATE_LIMITS;
        }
        return access ? PUBLIC_ANONYMOUS : PUBLIC_RATE_LIMITS;
    }

    /**
     * Gateway is checked before category, so an unknown pair reports the gateway.
     *
     * @throws PolicyEvaluationException of kind CONFIGURATION for unrecognized values
     */
    public static String resolve(String gateway, String category) {
        Gateway resolvedGateway = Gateway.fromId(gateway)
                .orElseThrow(() -> new PolicyEvaluationException(CONFIGURATION, "unknown gateway: " + gateway));
        PolicyCategory resolvedCategory = PolicyCategory.fromId(category)
                .orElseThrow(() -> new PolicyEvaluationException(CONFIGURATION, "unknown policy type: " + category));
        return resolve(resolvedGateway, resolvedCategory);
    }
}
