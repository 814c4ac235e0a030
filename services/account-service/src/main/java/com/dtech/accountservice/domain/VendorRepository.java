package com.dtech.accountservice.domain;

import com.dtech.security.Tenant;
import com.dtech.security.TenantStore;
import java.util.List;
import java.util.Optional;

/**
 * Vendor persistence. The {@link TenantStore} view exposes only the tenant part to the
 * authorization layer.
 */
public interface VendorRepository extends TenantStore {

    Vendor save(Vendor vendor);

    Optional<Vendor> findVendor(String id);

    Optional<Vendor> findByName(String name);

    /** All vendors ordered by name. */
    List<Vendor> findAll();

    @Override
    default Optional<Tenant> findById(String id) {
        return findVendor(id).map(Vendor::tenant);
    }
}
