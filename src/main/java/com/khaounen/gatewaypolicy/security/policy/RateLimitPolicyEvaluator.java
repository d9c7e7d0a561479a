package com.khaounen.gatewaypolicy.security.policy;

import java.time.Duration;

public interface RateLimitPolicyEvaluator {

    Evaluation<RateLimits> evaluateRateLimit(RateLimitRequest request);

    default Evaluation<RateLimits> evaluateRateLimit(RateLimitRequest request, Duration timeout) {
        return evaluateRateLimit(request);
    }
}
