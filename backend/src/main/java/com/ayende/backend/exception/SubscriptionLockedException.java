package com.ayende.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.PAYMENT_REQUIRED) // 402
public class SubscriptionLockedException extends RuntimeException {
    public SubscriptionLockedException(String message) {
        super(message);
    }
}
