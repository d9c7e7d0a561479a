package com.khaounen.gatewaypolicy.security.filters;

import com.khaounen.gatewaypolicy.config.RequestContext;
import com.khaounen.gatewaypolicy.security.policy.AccessPolicyEvaluator;
import com.khaounen.gatewaypolicy.security.policy.DecisionReason;
import com.khaounen.gatewaypolicy.security.policy.Evaluation;
import com.khaounen.gatewaypolicy.security.policy.PolicyDecision;
import com.khaounen.gatewaypolicy.security.policy.PolicyEngineProperties;
import com.khaounen.gatewaypolicy.security.policy.PolicyRequest;
import com.khaounen.gatewaypolicy.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Applies access decisions to inbound requests. Authentication is expected to have
 * happened already; the caller identity is read from the Spring Security context.
 */
@Slf4j
// after the Spring Security filter chain (order -100)
@Order(0)
public class PolicyEnforcementFilter extends OncePerRequestFilter {

    public static final String POLICY_ID_HEADER = "X-Policy-Id";

    private static final String ROLE_PREFIX = "ROLE_";
    private static final Set<String> WITHHELD_HEADERS = Set.of("authorization", "cookie", "proxy-authorization");

    private final PolicyEngineProperties.Filter settings;
    private final AccessPolicyEvaluator evaluator;

    public PolicyEnforcementFilter(PolicyEngineProperties.Filter settings, AccessPolicyEvaluator evaluator) {
        this.settings = settings;
        this.evaluator = evaluator;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (settings.isExcluded(request.getRequestURI())) {
            filterChain.doFilter(request, response);
            return;
        }

        PolicyRequest policyRequest = buildPolicyRequest(request);
        Evaluation<PolicyDecision> evaluation = evaluator.evaluateAccess(policyRequest);
        PolicyDecision decision = evaluation.value();

        if (evaluation.isFailed()) {
            log.warn(
                    "policy evaluation failed for {} {}: {}",
                    policyRequest.action(),
                    policyRequest.resource(),
                    evaluation.error().getMessage()
            );
            if (settings.isFailOpen()) {
                filterChain.doFilter(request, response);
                return;
            }
            reject(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, decision.reason());
            return;
        }

        RequestContext.setDecision(decision);
        if (decision.policyId() != null) {
            response.setHeader(POLICY_ID_HEADER, decision.policyId());
        }
        if (decision.allow()) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("access denied for {} {}: {}", policyRequest.action(), policyRequest.resource(), decision.reason());
        int status = decision.hasReason(DecisionReason.AUTHENTICATION_REQUIRED)
                ? HttpServletResponse.SC_UNAUTHORIZED
                : HttpServletResponse.SC_FORBIDDEN;
        reject(response, status, decision.reason());
    }

    PolicyRequest buildPolicyRequest(HttpServletRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String clientIp = RequestContext.getClientIp();
        return PolicyRequest.builder()
                .userId(userId(auth))
                .roles(roles(auth))
                .resource(request.getRequestURI())
                .action(request.getMethod())
                .gateway(settings.getGateway())
                .clientIp(clientIp != null ? clientIp : IpUtils.resolveIp(request))
                .headers(headers(request))
                .queryParams(queryParams(request))
                .build();
    }

    private static String userId(Authentication auth) {
        if (!isAuthenticated(auth)) {
            return "";
        }
        String name = auth.getName();
        return name == null ? "" : name;
    }

    private static List<String> roles(Authentication auth) {
        if (!isAuthenticated(auth)) {
            return List.of();
        }
        List<String> roles = new ArrayList<>();
        for (GrantedAuthority authority : auth.getAuthorities()) {
            String value = authority.getAuthority();
            if (value == null || value.isBlank()) {
                continue;
            }
            roles.add(value.startsWith(ROLE_PREFIX) ? value.substring(ROLE_PREFIX.length()) : value);
        }
        return roles;
    }

    private static boolean isAuthenticated(Authentication auth) {
        return auth != null && auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken);
    }

    private static Map<String, String> headers(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            if (WITHHELD_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            String value = request.getHeader(name);
            if (value != null) {
                headers.put(name, value);
            }
        }
        return headers;
    }

    private static Map<String, String> queryParams(HttpServletRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values != null && values.length > 0 && values[0] != null) {
                params.put(name, values[0]);
            }
        });
        return params;
    }

    private static void reject(HttpServletResponse response, int status, String reason) throws IOException {
        response.setStatus(status);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("text/plain;charset=UTF-8");
        response.getWriter().write(reason);
    }
}
