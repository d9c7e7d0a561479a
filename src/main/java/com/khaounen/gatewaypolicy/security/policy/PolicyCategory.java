package com.khaounen.gatewaypolicy.security.policy;

import java.util.Optional;

public enum PolicyCategory {
    ACCESS("access"),
    RATE_LIMIT("rate_limit");

    private final String id;

    PolicyCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<PolicyCategory> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (PolicyCategory category : values()) {
            if (category.id.equals(id)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
