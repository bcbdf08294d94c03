package com.ayende.backend.domain.enums;

import java.util.EnumSet;
import java.util.Set;

public enum RedemptionStatus {
    PENDING,
    APPROVED,
    USED,
    EXPIRED,
    CANCELLED,
    REJECTED;

    /** Statuses that count against a reward's per-customer limit. */
    public static final Set<RedemptionStatus> COUNTED = EnumSet.of(PENDING, APPROVED, USED);

    /** Statuses in which a redemption can still be used, cancelled or expire. */
    public static final Set<RedemptionStatus> OPEN = EnumSet.of(PENDING, APPROVED);

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
