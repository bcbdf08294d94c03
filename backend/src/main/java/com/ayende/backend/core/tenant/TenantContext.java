package com.ayende.backend.core.tenant;

import com.ayende.backend.domain.Tenant;
import com.ayende.backend.exception.TenantRequiredException;

import java.util.UUID;

/**
 * ThreadLocal holding the tenant resolved for the current request.
 * Pattern: setTenant() + getCurrentTenant() + clear().
 */
public final class TenantContext {

    private static final ThreadLocal<Tenant> currentTenant = new ThreadLocal<>();

    /**
     * Binds the tenant to the current thread (called by {@link TenantFilter}).
     */
    public static void setTenant(Tenant tenant) {
        currentTenant.set(tenant);
    }

    /**
     * The tenant of the current request, or null on platform and public surfaces.
     */
    public static Tenant getCurrentTenant() {
        return currentTenant.get();
    }

    public static UUID getCurrentTenantId() {
        Tenant tenant = currentTenant.get();
        return tenant != null ? tenant.getId() : null;
    }

    /**
     * For tenant-scoped operations: fails when the request was not addressed to a business.
     */
    public static Tenant requireCurrentTenant() {
        Tenant tenant = currentTenant.get();
        if (tenant == null) {
            throw new TenantRequiredException("This operation must be called on a business subdomain.");
        }
        return tenant;
    }

    /**
     * Must run in the filter's finally block, otherwise pooled threads leak tenants.
     */
    public static void clear() {
        currentTenant.remove();
    }

    private TenantContext() {
        throw new UnsupportedOperationException("Utility class");
    }
}
