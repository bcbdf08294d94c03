package com.ayende.backend.core.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    public static AuthenticatedMember getCurrentMember() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedMember member) {
            return member;
        }

        // Scheduled jobs run without a signed-in member
        throw new AuthenticationCredentialsNotFoundException("No authenticated member in the security context.");
    }

    private SecurityUtils() {
    }
}
