package com.ayende.backend.core.result;

import org.springframework.http.HttpStatus;

/**
 * Expected, recoverable refusals of ledger and rewards operations. They are returned to the
 * caller inside an {@link OperationResult}, never thrown.
 */
public enum ValidationError {
    INVALID_AMOUNT(HttpStatus.UNPROCESSABLE_ENTITY),
    DUPLICATE_TRANSACTION(HttpStatus.CONFLICT),
    INSUFFICIENT_POINTS(HttpStatus.CONFLICT),
    REWARD_UNAVAILABLE(HttpStatus.CONFLICT),
    REDEMPTION_LIMIT_REACHED(HttpStatus.CONFLICT),
    INVALID_STATE(HttpStatus.CONFLICT),
    REDEMPTION_NOT_VALID(HttpStatus.CONFLICT),
    REASON_REQUIRED(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus status;

    ValidationError(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
