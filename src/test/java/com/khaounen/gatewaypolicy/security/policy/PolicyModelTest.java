package com.khaounen.gatewaypolicy.security.policy;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyModelTest {

    @Test
    void policyRequestNormalizesMissingValues() {
        PolicyRequest request = new PolicyRequest(null, null, null, null, null, null, null, null);

        assertTrue(request.anonymous());
        assertEquals(List.of(), request.roles());
        assertEquals("", request.gateway());
        assertEquals(Map.of(), request.headers());
        assertEquals(Map.of(), request.queryParams());
    }

    @Test
    void policyRequestCopiesRoles() {
        List<String> roles = new ArrayList<>(List.of("user"));
        PolicyRequest request = PolicyRequest.builder().roles(roles).build();
        roles.add("admin");

        assertEquals(List.of("user"), request.roles());
    }

    @Test
    void rateLimitsTreatZeroAsDenyAll() {
        assertTrue(RateLimits.denyAll().isDenyAll());
        assertTrue(RateLimits.of(100, Duration.ZERO).isDenyAll());
        assertTrue(RateLimits.of(0, Duration.ofSeconds(60)).isDenyAll());
        assertFalse(RateLimits.of(100, Duration.ofSeconds(60)).isDenyAll());
    }

    @Test
    void evaluationCarriesFallbackWithError() {
        PolicyEvaluationException error = new PolicyEvaluationException(PolicyEvaluationException.Kind.TRANSPORT, "down");
        Evaluation<PolicyDecision> failed = Evaluation.failed(PolicyDecision.deny(DecisionReason.POLICY_EVALUATION_ERROR), error);

        assertTrue(failed.isFailed());
        assertSame(error, failed.errorIfAny().orElseThrow());
        assertFalse(failed.value().allow());
        assertSame(error, assertThrows(PolicyEvaluationException.class, failed::orThrow));
        assertThrows(NullPointerException.class, () -> Evaluation.ok(null));
    }

    @Test
    void decisionReportsDegradedMetadata() {
        PolicyDecision plain = PolicyDecision.deny(DecisionReason.NO_MATCHING_POLICY);
        PolicyDecision degraded = new PolicyDecision(false, "", "authz/admin_gateway/rbac", Map.of(PolicyDecision.DEGRADED, true));

        assertFalse(plain.degraded());
        assertTrue(degraded.degraded());
        assertTrue(plain.hasReason(DecisionReason.NO_MATCHING_POLICY));
    }

    @Test
    void enumsResolveWireIdentifiers() {
        assertEquals(Gateway.ADMIN, Gateway.fromId("admin-gateway").orElseThrow());
        assertTrue(Gateway.fromId("unknown").isEmpty());
        assertEquals(PolicyCategory.RATE_LIMIT, PolicyCategory.fromId("rate_limit").orElseThrow());
        assertTrue(Role.HEALTHCARE_STAFF.isIn(List.of("healthcare_staff")));
        assertFalse(Role.ADMIN.isIn(null));
    }
}
