package com.dtech.security;

import java.time.Instant;

/**
 * Verified payload of a session (auth) token.
 *
 * @param type   always {@link ClaimType#AUTH}
 * @param userId subject identity id
 * @param role   role snapshot at issuance; authorization uses the freshly loaded identity
 * @param expiry expiry managed by the session token service
 */
public record SessionClaims(ClaimType type, String userId, Role role, Instant expiry) {
}
