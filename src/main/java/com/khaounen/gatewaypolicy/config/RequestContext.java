package com.khaounen.gatewaypolicy.config;

import com.khaounen.gatewaypolicy.security.policy.PolicyDecision;

public final class RequestContext {

    private static final ThreadLocal<String> CLIENT_IP = new ThreadLocal<>();
    private static final ThreadLocal<PolicyDecision> DECISION = new ThreadLocal<>();

    private RequestContext() {}

    public static void setClientIp(String clientIp) {
        CLIENT_IP.set(clientIp);
    }

    public static String getClientIp() {
        return CLIENT_IP.get();
    }

    public static void setDecision(PolicyDecision decision) {
        DECISION.set(decision);
    }

    /** Access decision taken for the current request, if the policy filter ran. */
    public static PolicyDecision getDecision() {
        return DECISION.get();
    }

    public static void clear() {
        CLIENT_IP.remove();
        DECISION.remove();
    }
}
