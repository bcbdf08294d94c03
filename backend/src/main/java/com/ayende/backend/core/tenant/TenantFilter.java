package com.ayende.backend.core.tenant;

import com.ayende.backend.domain.Tenant;
import com.ayende.backend.dto.ApiError;
import com.ayende.backend.exception.SubscriptionLockedException;
import com.ayende.backend.exception.TenantNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * First filter of the security chain. Resolution errors are written here and the chain
 * stops, so no tenant-scoped code ever runs for an unknown or locked business.
 */
@Component
@RequiredArgsConstructor
public class TenantFilter extends OncePerRequestFilter {

    public static final String TENANT_ATTRIBUTE = "tenant";
    private static final String TENANT_PARAMETER = "tenant";

    private final TenantResolver tenantResolver;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String host = request.getHeader(HttpHeaders.HOST);
        if (host == null || host.isBlank()) {
            host = request.getServerName();
        }

        Optional<Tenant> tenant;
        try {
            tenant = tenantResolver.resolve(host, request.getRequestURI(), request.getParameter(TENANT_PARAMETER));
        } catch (TenantNotFoundException e) {
            writeError(response, HttpStatus.NOT_FOUND,
                    new ApiError("TENANT_NOT_FOUND", e.getMessage(), Map.of("subdomain", e.getSubdomain())));
            return;
        } catch (SubscriptionLockedException e) {
            writeError(response, HttpStatus.PAYMENT_REQUIRED,
                    new ApiError("SUBSCRIPTION_REQUIRED", e.getMessage(), Map.of()));
            return;
        }

        try {
            if (tenant.isPresent()) {
                TenantContext.setTenant(tenant.get());
                request.setAttribute(TENANT_ATTRIBUTE, tenant.get());
            }
            filterChain.doFilter(request, response);
        } finally {
            TenantContext.clear();
        }
    }

    private void writeError(HttpServletResponse response, HttpStatus status, ApiError body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
    }
}
