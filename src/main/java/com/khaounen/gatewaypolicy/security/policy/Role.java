package com.khaounen.gatewaypolicy.security.policy;

import java.util.Collection;

public enum Role {
    ADMIN("admin"),
    USER("user"),
    HEALTHCARE_STAFF("healthcare_staff"),
    USER_MANAGER("user_manager");

    private final String id;

    Role(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isIn(Collection<String> roles) {
        return roles != null && roles.contains(id);
    }
}
