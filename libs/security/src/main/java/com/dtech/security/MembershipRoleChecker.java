package com.dtech.security;

import java.util.Collection;
import java.util.List;

/**
 * Per-tenant role checks over an identity's memberships.
 */
public final class MembershipRoleChecker {

    private MembershipRoleChecker() {
        // utility class
    }

    /**
     * Returns true iff some membership belongs to both {@code tenantId} and {@code userId} and
     * carries one of {@code allowedRoles}. An empty {@code allowedRoles} never matches.
     */
    public static boolean hasRole(
            Collection<TenantRole> allowedRoles,
            List<TenantMembership> memberships,
            String tenantId,
            String userId) {
        if (allowedRoles == null || memberships == null || tenantId == null || userId == null) {
            return false;
        }
        return memberships.stream()
                .filter(membership -> membership.belongsTo(tenantId, userId))
                .anyMatch(membership -> allowedRoles.contains(membership.role()));
    }
}
