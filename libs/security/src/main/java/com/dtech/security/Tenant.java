package com.dtech.security;

/**
 * A vendor organization: the tenant boundary of the platform.
 *
 * @param id    unique tenant id (the {@code vendorId} route variable)
 * @param name  organization name
 * @param type  INTERNAL or EXTERNAL
 * @param state current subscription state, must be permitted by {@code type}
 */
public record Tenant(String id, String name, TenantType type, TenantState state) {

    public Tenant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (type == null || state == null) {
            throw new IllegalArgumentException("type and state must not be null");
        }
        if (!type.permits(state)) {
            throw new IllegalArgumentException(
                    "%s tenant cannot be in state %s".formatted(type, state));
        }
    }

    /**
     * Creates a tenant in the initial state of its type.
     */
    public static Tenant create(String id, String name, TenantType type) {
        return new Tenant(id, name, type, type.initialState());
    }

    public Tenant withState(TenantState newState) {
        return new Tenant(id, name, type, newState);
    }
}
