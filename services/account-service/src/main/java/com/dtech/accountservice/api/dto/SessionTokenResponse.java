package com.dtech.accountservice.api.dto;

/**
 * @param token     session token for the {@code Authorization: Bearer} header
 * @param expiresIn lifetime in seconds
 */
public record SessionTokenResponse(String token, String tokenType, long expiresIn) {

    public static SessionTokenResponse bearer(String token, long expiresIn) {
        return new SessionTokenResponse(token, "Bearer", expiresIn);
    }
}
