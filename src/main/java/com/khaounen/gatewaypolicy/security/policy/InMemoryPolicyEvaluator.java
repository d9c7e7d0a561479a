package com.khaounen.gatewaypolicy.security.policy;

import java.util.Objects;

import static com.khaounen.gatewaypolicy.security.policy.PolicyEvaluationException.Kind.CONFIGURATION;

/**
 * Evaluator backed by {@link AccessRules}, for tests and environments without a
 * reachable policy engine.
 */
public class InMemoryPolicyEvaluator implements PolicyEvaluator {

    @Override
    public Evaluation<PolicyDecision> evaluateAccess(PolicyRequest request) {
        Objects.requireNonNull(request, "request");
        return Evaluation.ok(AccessRules.decide(request));
    }

    @Override
    public Evaluation<RateLimits> evaluateRateLimit(RateLimitRequest request) {
        Objects.requireNonNull(request, "request");
        return AccessRules.limitsFor(request.gateway())
                .map(Evaluation::ok)
                .orElseGet(() -> Evaluation.failed(
                        RateLimits.denyAll(),
                        new PolicyEvaluationException(CONFIGURATION, "unknown gateway: " + request.gateway())
                ));
    }
}
