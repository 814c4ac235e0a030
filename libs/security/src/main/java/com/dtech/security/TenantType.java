package com.dtech.security;

import java.util.EnumSet;
import java.util.Set;

/**
 * Tenant kinds. The kind fixes the initial {@link TenantState} and the states a tenant may hold.
 */
public enum TenantType {

    INTERNAL("internal"),
    EXTERNAL("external");

    private final String value;

    TenantType(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    /**
     * The state a freshly created tenant of this type starts in.
     */
    public TenantState initialState() {
        return switch (this) {
            case INTERNAL -> TenantState.NORMAL;
            case EXTERNAL -> TenantState.SUBSCRIPTION_REQUIRED;
        };
    }

    /**
     * States a tenant of this type may ever hold.
     * <ul>
     *   <li>INTERNAL: NORMAL, LIMIT_EXCEEDED</li>
     *   <li>EXTERNAL: all states</li>
     * </ul>
     */
    public Set<TenantState> permittedStates() {
        return switch (this) {
            case INTERNAL -> EnumSet.of(TenantState.NORMAL, TenantState.LIMIT_EXCEEDED);
            case EXTERNAL -> EnumSet.allOf(TenantState.class);
        };
    }

    public boolean permits(TenantState state) {
        return permittedStates().contains(state);
    }
}
