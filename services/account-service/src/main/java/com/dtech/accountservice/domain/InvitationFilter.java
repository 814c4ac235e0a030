package com.dtech.accountservice.domain;

import com.dtech.security.TenantMembership;

/**
 * Selects memberships by the state of their vendor invitation.
 */
public enum InvitationFilter {

    ALL,
    ACCEPTED,
    PENDING;

    /** Asking for both or for neither selects every membership. */
    public static InvitationFilter of(boolean accepted, boolean pending) {
        if (accepted == pending) {
            return ALL;
        }
        return accepted ? ACCEPTED : PENDING;
    }

    public boolean matches(TenantMembership membership) {
        return switch (this) {
            case ALL -> true;
            case ACCEPTED -> membership.invitationAccepted();
            case PENDING -> !membership.invitationAccepted();
        };
    }
}
