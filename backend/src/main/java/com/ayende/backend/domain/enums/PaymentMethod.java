package com.ayende.backend.domain.enums;

public enum PaymentMethod {
    CASH,
    CARD,
    MOBILE,
    OTHER
}
