package com.dtech.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * HS256 JWT session tokens.
 * <p>
 * Subject is the identity id; a {@code type} claim of {@code auth} keeps other HS256 tokens signed
 * with the same key from verifying as sessions, and {@code role} records the role at issuance.
 */
public final class JwtSessionTokenService implements SessionTokenVerifier {

    static final String CLAIM_TYPE = "type";
    static final String CLAIM_ROLE = "role";

    /** HS256 needs a key of at least 256 bits. */
    private static final int MIN_SECRET_LENGTH = 32;

    private final SecretKey key;
    private final Duration expiry;
    private final Clock clock;

    public JwtSessionTokenService(String secret, Duration expiry, Clock clock) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "session token secret must be at least %d characters".formatted(MIN_SECRET_LENGTH));
        }
        if (expiry == null || expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("expiry must be positive");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiry = expiry;
        this.clock = clock;
    }

    /**
     * Issues a session token for {@code identity}, expiring after the configured duration.
     */
    public String issue(Identity identity) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(identity.id())
                .claim(CLAIM_TYPE, ClaimType.AUTH.value())
                .claim(CLAIM_ROLE, identity.role().value())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiry)))
                .signWith(key)
                .compact();
    }

    @Override
    public SessionClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw AuthorizationException.unauthorized(AuthorizationFailure.TOKEN_INVALID);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthorizationException(
                    AuthorizationFailure.unauthorized(AuthorizationFailure.TOKEN_INVALID), e);
        }

        if (!ClaimType.AUTH.value().equals(claims.get(CLAIM_TYPE, String.class))
                || claims.getSubject() == null
                || claims.getExpiration() == null) {
            throw AuthorizationException.unauthorized(AuthorizationFailure.TOKEN_INVALID);
        }
        Role role = Role.fromString(claims.get(CLAIM_ROLE, String.class))
                .orElseThrow(() -> AuthorizationException.unauthorized(AuthorizationFailure.TOKEN_INVALID));

        return new SessionClaims(ClaimType.AUTH, claims.getSubject(), role, claims.getExpiration().toInstant());
    }

    public Duration expiry() {
        return expiry;
    }
}
