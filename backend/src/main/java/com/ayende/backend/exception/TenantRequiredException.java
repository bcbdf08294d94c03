package com.ayende.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class TenantRequiredException extends RuntimeException {
    public TenantRequiredException(String message) {
        super(message);
    }
}
