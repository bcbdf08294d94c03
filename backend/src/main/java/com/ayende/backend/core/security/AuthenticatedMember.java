package com.ayende.backend.core.security;

import com.ayende.backend.domain.enums.MembershipRole;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Principal stored in the security context. Tenant fields are null for platform operators
 * signed in without a business subdomain.
 */
public record AuthenticatedMember(
        UUID customerId,
        String email,
        String fullName,
        UUID tenantId,
        UUID membershipId,
        MembershipRole role,
        boolean superuser
) {

    public static final String STAFF = "STAFF";
    public static final String PLATFORM_ADMIN = "PLATFORM_ADMIN";

    public boolean isStaffMember() {
        return role != null && role.isStaffMember();
    }

    public List<GrantedAuthority> authorities() {
        List<GrantedAuthority> authorities = new ArrayList<>();
        if (role != null) {
            authorities.add(new SimpleGrantedAuthority(role.name()));
            if (role.isStaffMember()) {
                authorities.add(new SimpleGrantedAuthority(STAFF));
            }
        }
        if (superuser) {
            authorities.add(new SimpleGrantedAuthority(PLATFORM_ADMIN));
        }
        return authorities;
    }
}
