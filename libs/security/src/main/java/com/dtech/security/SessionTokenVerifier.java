package com.dtech.security;

/**
 * Verifies an opaque session bearer token. Pure: no I/O, no side effects.
 */
@FunctionalInterface
public interface SessionTokenVerifier {

    /**
     * @param token the bearer token, without the scheme
     * @return the verified claims
     * @throws AuthorizationException with {@link FailureKind#UNAUTHORIZED} when the signature is
     *                                bad, the token is expired or it is malformed
     */
    SessionClaims verify(String token);
}
