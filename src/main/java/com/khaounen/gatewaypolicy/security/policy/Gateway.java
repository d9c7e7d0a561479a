package com.khaounen.gatewaypolicy.security.policy;

import java.util.Optional;

public enum Gateway {
    ADMIN("admin-gateway"),
    PUBLIC("public-gateway");

    private final String id;

    Gateway(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<Gateway> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (Gateway gateway : values()) {
            if (gateway.id.equals(id)) {
                return Optional.of(gateway);
            }
        }
        return Optional.empty();
    }
}
