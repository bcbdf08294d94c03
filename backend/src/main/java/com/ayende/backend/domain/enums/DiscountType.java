package com.ayende.backend.domain.enums;

public enum DiscountType {
    PERCENTAGE,
    FIXED
}
