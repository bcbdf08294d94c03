package com.ayende.backend.domain.enums;

public enum TransactionStatus {
    COMPLETED,
    PENDING,
    CANCELLED,
    REFUNDED
}
