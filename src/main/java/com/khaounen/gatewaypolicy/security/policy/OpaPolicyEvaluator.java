package com.khaounen.gatewaypolicy.security.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import static com.khaounen.gatewaypolicy.security.policy.PolicyEvaluationException.Kind.PROTOCOL;
import static com.khaounen.gatewaypolicy.security.policy.PolicyEvaluationException.Kind.TRANSPORT;

/**
 * Evaluator that queries an Open Policy Agent compatible data API:
 * {@code POST <endpoint>/v1/data/<policy path>} with {@code {"input": ...}}.
 * Every call is a fresh query; nothing is cached.
 */
@Slf4j
public class OpaPolicyEvaluator implements PolicyEvaluator {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Envelope(Map<String, Object> result) {
    }

    private static final Map<String, Class<?>> ACCESS_KEYS = orderedKeys(
            "allow", Boolean.class,
            "reason", String.class
    );
    private static final Map<String, Class<?>> RATE_LIMIT_KEYS = orderedKeys(
            "requests_per_window", Number.class,
            "time_window_seconds", Number.class
    );

    private final String endpoint;
    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    public OpaPolicyEvaluator(String endpoint) {
        this(endpoint, HttpClient.newHttpClient(), new ObjectMapper(), DEFAULT_TIMEOUT, 0, DEFAULT_RETRY_BACKOFF);
    }

    public OpaPolicyEvaluator(
            String endpoint,
            HttpClient client,
            ObjectMapper objectMapper,
            Duration timeout,
            int maxRetries,
            Duration retryBackoff
    ) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("policy engine endpoint must not be blank");
        }
        this.endpoint = stripTrailingSlashes(endpoint.trim());
        URI.create(this.endpoint);
        this.client = Objects.requireNonNull(client, "client");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? DEFAULT_RETRY_BACKOFF : retryBackoff;
    }

    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public Evaluation<PolicyDecision> evaluateAccess(PolicyRequest request) {
        return evaluateAccess(request, timeout);
    }

    @Override
    public Evaluation<PolicyDecision> evaluateAccess(PolicyRequest request, Duration callTimeout) {
        Objects.requireNonNull(request, "request");
        String policyPath;
        try {
            policyPath = PolicyPaths.resolve(request.gateway(), PolicyCategory.ACCESS.id());
        } catch (PolicyEvaluationException ex) {
            log.debug("policy path resolution failed: {}", ex.getMessage());
            return Evaluation.failed(PolicyDecision.deny(DecisionReason.UNKNOWN_GATEWAY), ex);
        }

        PolicyResult result;
        try {
            result = query(policyPath, accessInput(request), callTimeout);
        } catch (PolicyEvaluationException ex) {
            log.debug("access query to {} failed: {}", policyPath, ex.getMessage());
            return Evaluation.failed(
                    PolicyDecision.deny(DecisionReason.POLICY_EVALUATION_ERROR),
                    wrap(ex, "failed to query policy engine for access decision")
            );
        }

        List<String> missing = result.missingKeys(ACCESS_KEYS);
        warnIfDegraded(policyPath, missing);
        return Evaluation.ok(new PolicyDecision(
                result.getBoolean("allow"),
                result.getString("reason"),
                policyPath,
                missing.isEmpty() ? null : degradedMetadata(missing)
        ));
    }

    @Override
    public Evaluation<RateLimits> evaluateRateLimit(RateLimitRequest request) {
        return evaluateRateLimit(request, timeout);
    }

    @Override
    public Evaluation<RateLimits> evaluateRateLimit(RateLimitRequest request, Duration callTimeout) {
        Objects.requireNonNull(request, "request");
        String policyPath;
        try {
            policyPath = PolicyPaths.resolve(request.gateway(), PolicyCategory.RATE_LIMIT.id());
        } catch (PolicyEvaluationException ex) {
            log.debug("policy path resolution failed: {}", ex.getMessage());
            return Evaluation.failed(RateLimits.denyAll(), ex);
        }

        PolicyResult result;
        try {
            result = query(policyPath, rateLimitInput(request), callTimeout);
        } catch (PolicyEvaluationException ex) {
            log.debug("rate-limit query to {} failed: {}", policyPath, ex.getMessage());
            return Evaluation.failed(
                    RateLimits.denyAll(),
                    wrap(ex, "failed to query policy engine for rate limit decision")
            );
        }

        warnIfDegraded(policyPath, result.missingKeys(RATE_LIMIT_KEYS));
        return Evaluation.ok(RateLimits.of(
                result.getInt("requests_per_window"),
                Duration.ofSeconds(result.getLong("time_window_seconds"))
        ));
    }

    PolicyResult query(String policyPath, Map<String, Object> input, Duration callTimeout) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(Map.of("input", input));
        } catch (JsonProcessingException ex) {
            throw new PolicyEvaluationException(TRANSPORT, "failed to marshal query request: " + ex.getMessage(), ex);
        }

        URI uri = URI.create(endpoint + "/v1/data/" + policyPath);
        HttpResponse<String> response = send(uri, body, effectiveTimeout(callTimeout));
        if (response.statusCode() != 200) {
            throw new PolicyEvaluationException(
                    PROTOCOL,
                    "policy query failed with status " + response.statusCode() + ": " + response.body()
            );
        }
        return decode(response.body());
    }

    private HttpResponse<String> send(URI uri, byte[] body, Duration budget) {
        long deadline = System.nanoTime() + budget.toNanos();
        int attempt = 0;
        while (true) {
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isZero() || remaining.isNegative()) {
                throw new PolicyEvaluationException(TRANSPORT, "policy query timed out after " + budget.toMillis() + "ms");
            }
            HttpRequest request;
            try {
                request = HttpRequest.newBuilder(uri)
                        .timeout(remaining)
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                        .build();
            } catch (IllegalArgumentException ex) {
                throw new PolicyEvaluationException(TRANSPORT, "failed to create request: " + ex.getMessage(), ex);
            }
            try {
                return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new PolicyEvaluationException(TRANSPORT, "policy query cancelled", ex);
            } catch (HttpTimeoutException ex) {
                throw new PolicyEvaluationException(TRANSPORT, "policy query timed out: " + ex.getMessage(), ex);
            } catch (IOException ex) {
                if (attempt >= maxRetries) {
                    throw new PolicyEvaluationException(TRANSPORT, "failed to execute policy query: " + ex.getMessage(), ex);
                }
                attempt++;
                log.debug("policy query to {} failed, retry {}/{}: {}", uri, attempt, maxRetries, ex.getMessage());
                pauseBeforeRetry(attempt, deadline);
            }
        }
    }

    private void pauseBeforeRetry(int attempt, long deadline) {
        long base = retryBackoff.toMillis() << Math.min(attempt - 1, 10);
        long jitter = base > 0 ? ThreadLocalRandom.current().nextLong(base / 2 + 1) : 0;
        long remainingMillis = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
        long pause = Math.max(0, Math.min(base + jitter, remainingMillis));
        try {
            Thread.sleep(pause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PolicyEvaluationException(TRANSPORT, "policy query cancelled", ex);
        }
    }

    private PolicyResult decode(String body) {
        Envelope envelope;
        try {
            envelope = objectMapper.readValue(body, Envelope.class);
        } catch (JsonProcessingException ex) {
            throw new PolicyEvaluationException(PROTOCOL, "failed to parse policy engine response: " + ex.getMessage(), ex);
        }
        return envelope == null ? PolicyResult.empty() : PolicyResult.of(envelope.result());
    }

    private Duration effectiveTimeout(Duration callTimeout) {
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            return timeout;
        }
        return callTimeout;
    }

    private static void warnIfDegraded(String policyPath, List<String> missingKeys) {
        if (!missingKeys.isEmpty()) {
            log.warn("policy result from {} is missing or mistyped keys {}, using defaults", policyPath, missingKeys);
        }
    }

    private static Map<String, Object> degradedMetadata(List<String> missingKeys) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PolicyDecision.DEGRADED, true);
        metadata.put(PolicyDecision.MISSING_KEYS, List.copyOf(missingKeys));
        return metadata;
    }

    private static Map<String, Object> accessInput(PolicyRequest request) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("user_id", request.userId());
        user.put("roles", request.roles());

        Map<String, Object> req = new LinkedHashMap<>();
        req.put("resource", request.resource());
        req.put("action", request.action());
        req.put("gateway", request.gateway());
        req.put("client_ip", request.clientIp() == null ? "" : request.clientIp());
        req.put("headers", request.headers());

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("user", user);
        input.put("request", req);
        return input;
    }

    private static Map<String, Object> rateLimitInput(RateLimitRequest request) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("user_id", request.userId());

        Map<String, Object> req = new LinkedHashMap<>();
        req.put("client_ip", request.clientIp());
        req.put("gateway", request.gateway());
        req.put("endpoint", request.endpoint() == null ? "" : request.endpoint());

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("user", user);
        input.put("request", req);
        return input;
    }

    private static PolicyEvaluationException wrap(PolicyEvaluationException cause, String message) {
        return new PolicyEvaluationException(cause.getKind(), message + ": " + cause.getMessage(), cause);
    }

    private static Map<String, Class<?>> orderedKeys(String firstKey, Class<?> firstType, String secondKey, Class<?> secondType) {
        Map<String, Class<?>> keys = new LinkedHashMap<>();
        keys.put(firstKey, firstType);
        keys.put(secondKey, secondType);
        return keys;
    }

    private static String stripTrailingSlashes(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
