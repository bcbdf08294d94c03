package com.ayende.backend.domain.enums;

public enum MembershipRole {
    OWNER,     // Business owner, one per tenant
    ADMIN,
    MANAGER,
    STAFF,
    CUSTOMER;  // End customer

    /**
     * Every role except {@link #CUSTOMER} belongs to the business team.
     */
    public boolean isStaffMember() {
        return this != CUSTOMER;
    }

    public boolean canManageCustomers() {
        return this == OWNER || this == ADMIN || this == MANAGER;
    }

    public boolean canSendNotifications() {
        return isStaffMember();
    }

    public boolean canManageTeam() {
        return this == OWNER || this == ADMIN;
    }
}
