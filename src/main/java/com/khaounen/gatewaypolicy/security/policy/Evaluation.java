package com.khaounen.gatewaypolicy.security.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an evaluator call. {@code value} is always safe to act on: when
 * {@code error} is set it holds the deny / zero-limit fallback.
 */
public record Evaluation<T>(T value, PolicyEvaluationException error) {

    public Evaluation {
        Objects.requireNonNull(value, "value");
    }

    public static <T> Evaluation<T> ok(T value) {
        return new Evaluation<>(value, null);
    }

    public static <T> Evaluation<T> failed(T fallback, PolicyEvaluationException error) {
        return new Evaluation<>(fallback, Objects.requireNonNull(error, "error"));
    }

    public boolean isFailed() {
        return error != null;
    }

    public Optional<PolicyEvaluationException> errorIfAny() {
        return Optional.ofNullable(error);
    }

    public T orThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}
