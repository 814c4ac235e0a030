package com.dtech.security;

/**
 * Membership of a {@link Role#VENDOR} identity in one tenant. Unique per (tenantId, userId).
 *
 * @param tenantId           the tenant
 * @param userId             the member identity
 * @param role               the member's role inside the tenant
 * @param invitationAccepted whether the member accepted the tenant invitation
 */
public record TenantMembership(
        String tenantId,
        String userId,
        TenantRole role,
        boolean invitationAccepted
) {

    public TenantMembership {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /** A freshly invited, not yet accepted membership. */
    public static TenantMembership pending(String tenantId, String userId, TenantRole role) {
        return new TenantMembership(tenantId, userId, role, false);
    }

    public boolean belongsTo(String tenantId, String userId) {
        return this.tenantId.equals(tenantId) && this.userId.equals(userId);
    }

    public TenantMembership withRole(TenantRole newRole) {
        return new TenantMembership(tenantId, userId, newRole, invitationAccepted);
    }

    public TenantMembership accepted() {
        return new TenantMembership(tenantId, userId, role, true);
    }
}
