package com.dtech.security;

import java.util.List;
import java.util.Optional;

/**
 * Read access to tenant memberships. Implementations must be safe for concurrent use.
 */
public interface MembershipStore {

    /**
     * All memberships of an identity, accepted or pending. Empty list when there are none.
     */
    List<TenantMembership> listByUser(String userId);

    Optional<TenantMembership> find(String tenantId, String userId);
}
