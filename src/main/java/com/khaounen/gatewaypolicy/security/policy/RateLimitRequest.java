package com.khaounen.gatewaypolicy.security.policy;

public record RateLimitRequest(
        String userId,
        String clientIp,
        String gateway,
        String endpoint
) {
    public RateLimitRequest {
        userId = userId == null ? "" : userId;
        clientIp = clientIp == null ? "" : clientIp;
        gateway = gateway == null ? "" : gateway;
    }

    public static RateLimitRequest forGateway(String gateway) {
        return new RateLimitRequest(null, null, gateway, null);
    }
}
