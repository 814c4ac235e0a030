package com.dtech.security;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Claims bound by a reset-password token signature.
 *
 * @param email        address whose ownership the token proves
 * @param expiryMillis expiry as epoch milliseconds; the token is valid while {@code now < expiry}
 */
@JsonPropertyOrder({"email", "expiry"})
public record ResetPasswordClaims(
        @JsonProperty("email") String email,
        @JsonProperty("expiry") long expiryMillis
) {

    public Instant expiresAt() {
        return Instant.ofEpochMilli(expiryMillis);
    }

    public boolean isExpiredAt(Instant now) {
        return now.toEpochMilli() >= expiryMillis;
    }
}
