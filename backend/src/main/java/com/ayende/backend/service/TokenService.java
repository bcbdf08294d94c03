package com.ayende.backend.service;

import com.ayende.backend.core.security.AuthenticatedMember;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class TokenService {

    public static final String TENANT_CLAIM = "tenantId";
    public static final String ROLE_CLAIM = "role";

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration}")
    private Long expiration; // millis

    /**
     * The token names the business it was issued for. A token without a tenant claim is only
     * good on the platform host.
     */
    public String generateToken(AuthenticatedMember member) {
        Map<String, Object> claims = new HashMap<>();
        if (member.tenantId() != null) {
            claims.put(TENANT_CLAIM, member.tenantId().toString());
            claims.put(ROLE_CLAIM, member.role().name());
        }
        return createToken(claims, member.email());
    }

    private String createToken(Map<String, Object> claims, String subject) {
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(subject)
                .setIssuedAt(new Date(System.currentTimeMillis()))
                .setExpiration(new Date(System.currentTimeMillis() + expiration))
                .signWith(getSignKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    private Key getSignKey() {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /** Empty when the token is expired, tampered with or not a JWT at all. */
    public Optional<Claims> readToken(String token) {
        try {
            return Optional.of(extractAllClaims(token));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static UUID tenantIdOf(Claims claims) {
        String value = claims.get(TENANT_CLAIM, String.class);
        return value != null ? UUID.fromString(value) : null;
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSignKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
