package com.ayende.backend.domain.enums;

public enum RewardType {
    DISCOUNT,
    PRODUCT,
    GIFT,
    UPGRADE
}
