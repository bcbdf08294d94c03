package com.ayende.backend.domain.enums;

public enum TransactionType {
    PURCHASE,
    REFUND,
    ADJUSTMENT
}
