package com.dtech.security;

import java.util.List;
import java.util.Set;

/**
 * The verified caller of a request, handed to downstream handlers.
 *
 * @param identity    the identity as loaded during authorization
 * @param memberships all tenant memberships of a VENDOR identity; empty for ADMINs and for
 *                    invitation/reset-password credentials
 */
public record AuthorizedContext(Identity identity, List<TenantMembership> memberships) {

    public AuthorizedContext {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        memberships = memberships == null ? List.of() : List.copyOf(memberships);
    }

    public static AuthorizedContext of(Identity identity) {
        return new AuthorizedContext(identity, List.of());
    }

    public String userId() {
        return identity.id();
    }

    public Role role() {
        return identity.role();
    }

    /**
     * Ad-hoc tenant role check for handlers, see {@link MembershipRoleChecker#hasRole}.
     */
    public boolean hasTenantRole(String tenantId, TenantRole... roles) {
        return MembershipRoleChecker.hasRole(Set.of(roles), memberships, tenantId, identity.id());
    }
}
