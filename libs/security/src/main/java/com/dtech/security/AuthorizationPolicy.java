package com.dtech.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-route authorization options. Empty role sets mean "no restriction".
 *
 * @param allowedGlobalRoles           roles allowed to pass (empty = any authenticated identity)
 * @param allowedTenantRoles           tenant roles required in the route's tenant (empty = any)
 * @param allowPendingTenantInvitation whether a VENDOR with a pending membership in the route's
 *                                     tenant may pass (used to accept that invitation)
 * @throws SecurityMisconfigurationException if tenant roles are configured while the global roles
 *                                           exclude {@link Role#VENDOR}
 */
public record AuthorizationPolicy(
        Set<Role> allowedGlobalRoles,
        Set<TenantRole> allowedTenantRoles,
        boolean allowPendingTenantInvitation
) {

    public AuthorizationPolicy {
        allowedGlobalRoles = immutableCopy(allowedGlobalRoles, Role.class);
        allowedTenantRoles = immutableCopy(allowedTenantRoles, TenantRole.class);
        if (!allowedTenantRoles.isEmpty() && !allowedGlobalRoles.contains(Role.VENDOR)) {
            throw new SecurityMisconfigurationException(
                    "Cannot check tenant roles %s when global roles %s do not include VENDOR"
                            .formatted(allowedTenantRoles, allowedGlobalRoles));
        }
    }

    /** Any authenticated identity with an accepted invitation passes. */
    public static AuthorizationPolicy anyAuthenticated() {
        return new AuthorizationPolicy(Set.of(), Set.of(), false);
    }

    /** Only identities holding one of {@code roles} pass. */
    public static AuthorizationPolicy forRoles(Role... roles) {
        return new AuthorizationPolicy(Set.of(roles), Set.of(), false);
    }

    /** Returns a copy additionally requiring one of {@code tenantRoles} in the route's tenant. */
    public AuthorizationPolicy withTenantRoles(TenantRole... tenantRoles) {
        return new AuthorizationPolicy(allowedGlobalRoles, Set.of(tenantRoles), allowPendingTenantInvitation);
    }

    /** Returns a copy that lets VENDORs with a pending invitation to the route's tenant through. */
    public AuthorizationPolicy allowingPendingTenantInvitation() {
        return new AuthorizationPolicy(allowedGlobalRoles, allowedTenantRoles, true);
    }

    public boolean restrictsGlobalRoles() {
        return !allowedGlobalRoles.isEmpty();
    }

    public boolean restrictsTenantRoles() {
        return !allowedTenantRoles.isEmpty();
    }

    private static <E extends Enum<E>> Set<E> immutableCopy(Set<E> source, Class<E> type) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(source));
    }
}
