package com.dtech.security;

import java.util.Optional;

/**
 * Read access to tenants. Implementations must be safe for concurrent use.
 */
public interface TenantStore {

    Optional<Tenant> findById(String id);
}
