package com.dtech.accountservice.domain;

import com.dtech.security.Tenant;
import com.dtech.security.TenantState;
import com.dtech.security.TenantType;

/**
 * A tenant together with its plan settings.
 *
 * @param tenant    identity, type and subscription state as seen by the authorization layer
 * @param userLimit maximum number of memberships, pending ones included
 */
public record Vendor(Tenant tenant, int userLimit) {

    public Vendor {
        if (tenant == null) {
            throw new IllegalArgumentException("tenant must not be null");
        }
        if (userLimit < 1) {
            throw new IllegalArgumentException("userLimit must be at least 1");
        }
    }

    public static Vendor create(String id, String name, TenantType type, int userLimit) {
        return new Vendor(Tenant.create(id, name, type), userLimit);
    }

    public String id() {
        return tenant.id();
    }

    public String name() {
        return tenant.name();
    }

    public TenantType type() {
        return tenant.type();
    }

    public TenantState state() {
        return tenant.state();
    }

    public Vendor withState(TenantState state) {
        return new Vendor(tenant.withState(state), userLimit);
    }
}
