package com.ayende.backend.dto;

import com.ayende.backend.domain.enums.MembershipRole;

import java.util.UUID;

public class AuthDTOs {

    public record LoginRequest(String email, String password) {}

    public record LoginResponse(
        String token,
        UUID customerId,
        String fullName,
        String email,
        UUID tenantId,
        UUID membershipId,
        MembershipRole role
    ) {}

    public record RegisterRequest(
        String email,
        String password,
        String firstName,
        String lastName,
        String phone
    ) {}
}
