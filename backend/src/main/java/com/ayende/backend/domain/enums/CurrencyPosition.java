package com.ayende.backend.domain.enums;

public enum CurrencyPosition {
    BEFORE, // $10.00
    AFTER   // 10.00€
}
