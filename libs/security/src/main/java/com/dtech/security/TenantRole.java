package com.dtech.security;

/**
 * Roles a {@link Role#VENDOR} identity holds inside a single tenant.
 */
public enum TenantRole {

    ADMIN("ADMIN"),
    ANALYST("ANALYST"),
    VETTER("VETTER");

    private final String value;

    TenantRole(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }
}
