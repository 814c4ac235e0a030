package com.dtech.accountservice.domain;

import com.dtech.security.MembershipStore;
import com.dtech.security.TenantMembership;
import java.util.List;

public interface MembershipRepository extends MembershipStore {

    /** Inserts or replaces the membership for its (tenant, user) pair. */
    TenantMembership save(TenantMembership membership);

    void remove(String tenantId, String userId);

    void removeAllForUser(String userId);

    List<TenantMembership> listByTenant(String tenantId);

    int countByTenant(String tenantId);
}
