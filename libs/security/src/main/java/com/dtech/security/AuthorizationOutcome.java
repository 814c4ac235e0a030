package com.dtech.security;

import java.util.Optional;

/**
 * Result of authorizing a request: either a granted {@link AuthorizedContext} or a typed
 * {@link AuthorizationFailure}. Exactly one of the two is present.
 *
 * @param context the authorized caller when granted, otherwise {@code null}
 * @param failure the rejection when denied, otherwise {@code null}
 */
public record AuthorizationOutcome(AuthorizedContext context, AuthorizationFailure failure) {

    public AuthorizationOutcome {
        if ((context == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of context and failure must be set");
        }
    }

    public static AuthorizationOutcome granted(AuthorizedContext context) {
        return new AuthorizationOutcome(context, null);
    }

    public static AuthorizationOutcome denied(AuthorizationFailure failure) {
        return new AuthorizationOutcome(null, failure);
    }

    public boolean isGranted() {
        return context != null;
    }

    public Optional<AuthorizedContext> grantedContext() {
        return Optional.ofNullable(context);
    }
}
