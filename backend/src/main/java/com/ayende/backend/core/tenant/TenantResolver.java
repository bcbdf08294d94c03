package com.ayende.backend.core.tenant;

import com.ayende.backend.domain.Tenant;
import com.ayende.backend.exception.SubscriptionLockedException;
import com.ayende.backend.exception.TenantNotFoundException;
import com.ayende.backend.repository.TenantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a request (host + path) to the business it addresses.
 *
 * <p>An empty result means "no tenant": platform admin pages, static assets and the public
 * landing site. A subdomain that names no active business, or a business whose subscription
 * does not allow access, ends the request with an exception; there is no default tenant.
 */
@Slf4j
@Service
public class TenantResolver {

    private final TenantRepository tenantRepository;
    private final SubdomainParser subdomainParser;
    private final List<String> bypassPaths;
    private final boolean allowQueryParameter;

    public TenantResolver(TenantRepository tenantRepository,
                          SubdomainParser subdomainParser,
                          @Value("${ayende.tenancy.bypass-paths}") List<String> bypassPaths,
                          @Value("${ayende.tenancy.allow-query-parameter:false}") boolean allowQueryParameter) {
        this.tenantRepository = tenantRepository;
        this.subdomainParser = subdomainParser;
        this.bypassPaths = List.copyOf(bypassPaths);
        this.allowQueryParameter = allowQueryParameter;
    }

    @Transactional(readOnly = true)
    public Optional<Tenant> resolve(String host, String path, String tenantParameter) {
        if (isBypassed(path)) {
            return Optional.empty();
        }

        Optional<String> slug = subdomainParser.extractSubdomain(host);
        if (slug.isEmpty() && allowQueryParameter && tenantParameter != null && !tenantParameter.isBlank()) {
            slug = Optional.of(tenantParameter.trim().toLowerCase(Locale.ROOT));
        }
        if (slug.isEmpty()) {
            return Optional.empty();
        }

        String subdomain = slug.get();
        Tenant tenant = tenantRepository.findBySlugAndActiveTrue(subdomain)
                .orElseThrow(() -> {
                    log.warn("No active business for subdomain '{}' (host {})", subdomain, host);
                    return new TenantNotFoundException(subdomain);
                });

        if (!tenant.isSubscriptionActive(LocalDateTime.now())) {
            log.warn("Business '{}' blocked, subscription status {}", subdomain, tenant.getSubscriptionStatus());
            throw new SubscriptionLockedException(
                    "The subscription for " + tenant.getName() + " is not active (" + tenant.getSubscriptionStatus() + ").");
        }
        return Optional.of(tenant);
    }

    public boolean isBypassed(String path) {
        if (path == null) {
            return false;
        }
        return bypassPaths.stream().anyMatch(path::startsWith);
    }
}
