package com.dtech.security;

import java.time.Clock;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Self-contained, time-limited reset-password tokens: {@code <email>:<expiryEpochMillis>:<hmacHex>}.
 * <p>
 * The signature is an HMAC-SHA256 over {@link ResetPasswordClaims}. A token is valid while
 * {@code now < expiry}; a token verified at its expiry instant is already expired.
 */
public final class ResetPasswordTokenCodec {

    static final String SEPARATOR = ":";
    static final String TOKEN_NOT_VALID = "Token is not valid";

    private static final Pattern EPOCH_MILLIS = Pattern.compile("\\d{1,18}");

    private final ClaimSigner signer;
    private final Duration defaultTtl;
    private final Clock clock;

    public ResetPasswordTokenCodec(String secret, Duration defaultTtl, Clock clock) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        this.signer = new ClaimSigner(secret);
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    /** Issues a token valid for the configured default TTL. */
    public String issue(Identity identity) {
        return issue(identity, defaultTtl);
    }

    /**
     * Issues a token for {@code identity}'s e-mail, valid for {@code ttl}.
     */
    public String issue(Identity identity, Duration ttl) {
        if (identity.email().contains(SEPARATOR)) {
            throw new IllegalArgumentException("email must not contain '" + SEPARATOR + "'");
        }
        long expiry = clock.millis() + ttl.toMillis();
        var claims = new ResetPasswordClaims(identity.email(), expiry);
        return String.join(SEPARATOR, identity.email(), Long.toString(expiry), signer.sign(claims));
    }

    /**
     * Verifies {@code token} and returns its claims.
     *
     * @throws AuthorizationException {@link FailureKind#UNAUTHORIZED} when the token is missing,
     *                                malformed, expired or carries a wrong signature
     */
    public ResetPasswordClaims verify(String token) {
        if (token == null) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }
        String[] parts = token.split(SEPARATOR, -1);
        if (parts.length != 3 || !EPOCH_MILLIS.matcher(parts[1]).matches()) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }

        var claims = new ResetPasswordClaims(parts[0], Long.parseLong(parts[1]));
        if (claims.isExpiredAt(clock.instant())) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }
        if (!signer.verify(claims, parts[2])) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }
        return claims;
    }
}
