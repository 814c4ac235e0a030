package com.dtech.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects requests against tenants whose subscription state does not allow the action.
 * <p>
 * Runs after a tenant id has been resolved from the route. It only reads tenant state.
 */
public final class TenantStateGate {

    private final TenantStore tenants;
    private final Set<TenantState> allowedStates;

    /** Gate allowing only {@link TenantState#NORMAL}. */
    public TenantStateGate(TenantStore tenants) {
        this(tenants, EnumSet.of(TenantState.NORMAL));
    }

    public TenantStateGate(TenantStore tenants, Set<TenantState> allowedStates) {
        if (tenants == null) {
            throw new SecurityMisconfigurationException("tenants must not be null");
        }
        if (allowedStates == null || allowedStates.isEmpty()) {
            throw new SecurityMisconfigurationException("allowedStates must not be empty");
        }
        this.tenants = tenants;
        this.allowedStates = Collections.unmodifiableSet(EnumSet.copyOf(allowedStates));
    }

    /**
     * Checks the tenant's current state.
     *
     * @return empty when the state is allowed, otherwise the failure (NOT_FOUND or FORBIDDEN)
     * @throws SecurityMisconfigurationException if {@code tenantId} is missing
     */
    public Optional<AuthorizationFailure> check(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new SecurityMisconfigurationException(
                    "Tenant state check requires a tenant id resolved from the route");
        }
        Optional<Tenant> tenant = tenants.findById(tenantId);
        if (tenant.isEmpty()) {
            return Optional.of(AuthorizationFailure.notFound("Vendor with this id does not exist"));
        }
        if (!allowedStates.contains(tenant.get().state())) {
            return Optional.of(AuthorizationFailure.forbidden(AuthorizationFailure.PLAN_STATUS_NOT_ALLOWED));
        }
        return Optional.empty();
    }

    public Set<TenantState> allowedStates() {
        return allowedStates;
    }
}
