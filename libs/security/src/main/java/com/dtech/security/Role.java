package com.dtech.security;

import java.util.Optional;

/**
 * Global roles, scoped to the whole platform.
 * <p>
 * An {@code ADMIN} operates every vendor and never holds tenant memberships. A {@code VENDOR}
 * reaches tenants only through {@link TenantMembership}s, each carrying a {@link TenantRole}.
 */
public enum Role {

    ADMIN("ADMIN"),
    VENDOR("VENDOR");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "VENDOR"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Role by its canonical string value.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
