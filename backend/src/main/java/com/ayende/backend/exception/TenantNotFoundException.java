package com.ayende.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class TenantNotFoundException extends RuntimeException {

    private final String subdomain;

    public TenantNotFoundException(String subdomain) {
        super("Business not found: no business at subdomain '" + subdomain + "'.");
        this.subdomain = subdomain;
    }

    public String getSubdomain() {
        return subdomain;
    }
}
