package com.ayende.backend.domain.enums;

public enum SubscriptionStatus {
    TRIAL,
    ACTIVE,
    PAST_DUE,
    SUSPENDED,
    CANCELLED;

    /** Only trial and paid tenants may serve requests. */
    public boolean allowsAccess() {
        return this == TRIAL || this == ACTIVE;
    }
}
