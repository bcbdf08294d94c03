package com.ayende.backend.core.security;

import org.springframework.http.HttpStatus;

public enum AuthFailure {
    // Unknown email and wrong password share one answer
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password."),
    ACCOUNT_INACTIVE(HttpStatus.UNAUTHORIZED, "This account has been deactivated."),
    EMAIL_NOT_VERIFIED(HttpStatus.UNAUTHORIZED, "Please verify your email address before logging in."),
    NO_TENANT_ACCESS(HttpStatus.FORBIDDEN, "You do not have access to this business."),
    NO_TENANT_CONTEXT(HttpStatus.FORBIDDEN, "Sign in from your business address.");

    private final HttpStatus status;
    private final String message;

    AuthFailure(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }
}
