package com.ayende.backend.config.security;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.service.TokenService;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bearer token authentication. Runs after {@code TenantFilter}: a token is only accepted when
 * the business it was issued for is the business this request was resolved to, so a session
 * never crosses subdomains. Role and active flags are re-read on every request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityFilter extends OncePerRequestFilter {

    private final TokenService tokenService;
    private final CustomerRepository customerRepository;
    private final MembershipRepository membershipRepository;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = recoverToken(request);
        if (token != null) {
            tokenService.readToken(token)
                    .flatMap(this::loadMember)
                    .ifPresent(member -> {
                        var authentication = new UsernamePasswordAuthenticationToken(member, null, member.authorities());
                        SecurityContextHolder.getContext().setAuthentication(authentication);
                    });
        }
        filterChain.doFilter(request, response);
    }

    private Optional<AuthenticatedMember> loadMember(Claims claims) {
        UUID tokenTenant = TokenService.tenantIdOf(claims);
        UUID requestTenant = TenantContext.getCurrentTenantId();

        if (!Objects.equals(tokenTenant, requestTenant)) {
            log.warn("Token issued for business {} presented to business {}", tokenTenant, requestTenant);
            return Optional.empty();
        }

        Optional<Customer> customer = customerRepository.findByEmail(claims.getSubject());
        if (customer.isEmpty() || !customer.get().isActive()) {
            return Optional.empty();
        }
        Customer c = customer.get();

        if (requestTenant == null) {
            if (!c.isSuperuser()) {
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedMember(c.getId(), c.getEmail(), c.getFullName(), null, null, null, true));
        }

        Optional<Membership> membership = membershipRepository.findByCustomerIdAndTenantId(c.getId(), requestTenant);
        if (membership.isEmpty() || !membership.get().isActive()) {
            return Optional.empty();
        }
        Membership m = membership.get();
        return Optional.of(new AuthenticatedMember(c.getId(), c.getEmail(), c.getFullName(),
                requestTenant, m.getId(), m.getRole(), c.isSuperuser()));
    }

    private String recoverToken(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            return null;
        }
        return authHeader.substring("Bearer ".length()).trim();
    }
}
