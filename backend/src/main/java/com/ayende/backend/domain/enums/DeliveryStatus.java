package com.ayende.backend.domain.enums;

public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED
}
