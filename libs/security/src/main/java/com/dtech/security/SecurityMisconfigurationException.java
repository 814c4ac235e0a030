package com.dtech.security;

/**
 * Programmer misuse of the authorization components, as opposed to a rejected request.
 * <p>
 * Raised when a policy is built with contradictory options, or when a tenant-scoped check runs
 * without a resolved tenant id (wrong ordering of checks). Surfaces as a server error.
 */
public class SecurityMisconfigurationException extends RuntimeException {

    public SecurityMisconfigurationException(String message) {
        super(message);
    }
}
