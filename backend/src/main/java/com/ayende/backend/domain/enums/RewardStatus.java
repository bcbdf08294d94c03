package com.ayende.backend.domain.enums;

public enum RewardStatus {
    ACTIVE,
    INACTIVE,
    EXPIRED,
    OUT_OF_STOCK
}
