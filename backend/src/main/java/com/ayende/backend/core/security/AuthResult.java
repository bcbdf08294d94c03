package com.ayende.backend.core.security;

/**
 * Outcome of a login attempt: the signed-in member and its token, or the reason it was refused.
 */
public record AuthResult(AuthenticatedMember member, String token, AuthFailure failure) {

    public static AuthResult success(AuthenticatedMember member, String token) {
        return new AuthResult(member, token, null);
    }

    public static AuthResult failure(AuthFailure failure) {
        return new AuthResult(null, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
