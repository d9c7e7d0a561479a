package com.khaounen.gatewaypolicy.security.policy;

import java.util.List;
import java.util.Map;

/**
 * An access-control question raised by a gateway for a single inbound request.
 * An empty {@code userId} marks an anonymous caller.
 */
public record PolicyRequest(
        String userId,
        List<String> roles,
        String resource,
        String action,
        String gateway,
        String clientIp,
        Map<String, String> headers,
        Map<String, String> queryParams
) {
    public PolicyRequest {
        userId = userId == null ? "" : userId;
        roles = roles == null ? List.of() : List.copyOf(roles);
        resource = resource == null ? "" : resource;
        action = action == null ? "" : action;
        gateway = gateway == null ? "" : gateway;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
    }

    public boolean anonymous() {
        return userId.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String userId;
        private List<String> roles;
        private String resource;
        private String action;
        private String gateway;
        private String clientIp;
        private Map<String, String> headers;
        private Map<String, String> queryParams;

        private Builder() {
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder roles(List<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder roles(String... roles) {
            this.roles = List.of(roles);
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder gateway(String gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder gateway(Gateway gateway) {
            this.gateway = gateway.id();
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder queryParams(Map<String, String> queryParams) {
            this.queryParams = queryParams;
            return this;
        }

        public PolicyRequest build() {
            return new PolicyRequest(userId, roles, resource, action, gateway, clientIp, headers, queryParams);
        }
    }
}
