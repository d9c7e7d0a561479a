package com.khaounen.gatewaypolicy.security.policy;

import java.time.Duration;
import java.time.Instant;

/**
 * Limit parameters for an external limiter. A zero budget means deny all, never unlimited.
 * {@code currentCount} and {@code resetTime} are left unset by the evaluators.
 */
public record RateLimits(
        int requestsPerWindow,
        Duration timeWindow,
        Integer currentCount,
        Instant resetTime
) {

    public RateLimits {
        timeWindow = timeWindow == null ? Duration.ZERO : timeWindow;
    }

    public static RateLimits of(int requestsPerWindow, Duration timeWindow) {
        return new RateLimits(requestsPerWindow, timeWindow, null, null);
    }

    public static RateLimits denyAll() {
        return new RateLimits(0, Duration.ZERO, null, null);
    }

    public boolean isDenyAll() {
        return requestsPerWindow <= 0 || timeWindow.isZero() || timeWindow.isNegative();
    }
}
