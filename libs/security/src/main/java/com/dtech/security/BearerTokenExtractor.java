package com.dtech.security;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * <p>
     * Expects exactly two whitespace-separated parts: {@code "Bearer <token>"}, with a
     * case-insensitive scheme.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing/malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String[] parts = WHITESPACE.split(authorizationHeader.strip());
        if (parts.length != 2 || !SCHEME.equalsIgnoreCase(parts[0])) {
            return Optional.empty();
        }
        return Optional.of(parts[1]);
    }
}
