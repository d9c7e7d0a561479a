package com.khaounen.gatewaypolicy.security.policy;

public interface PolicyEvaluator extends AccessPolicyEvaluator, RateLimitPolicyEvaluator {
}
