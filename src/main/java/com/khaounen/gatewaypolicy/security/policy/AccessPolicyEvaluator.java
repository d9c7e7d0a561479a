package com.khaounen.gatewaypolicy.security.policy;

import java.time.Duration;

public interface AccessPolicyEvaluator {

    Evaluation<PolicyDecision> evaluateAccess(PolicyRequest request);

    /**
     * Same as {@link #evaluateAccess(PolicyRequest)} with a per-call time budget.
     * Implementations without I/O ignore the timeout.
     */
    default Evaluation<PolicyDecision> evaluateAccess(PolicyRequest request, Duration timeout) {
        return evaluateAccess(request);
    }
}
