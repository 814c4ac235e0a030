package com.dtech.accountservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Secrets and lifetimes of the three token schemes, bound from {@code dtech.token.*}.
 *
 * <p>Expiries default to one day. Invitation tokens never expire.
 */
@ConfigurationProperties(prefix = "dtech.token")
@Validated
public record TokenProperties(
        @Valid @NotNull Auth auth,
        @Valid @NotNull Invitation invitation,
        @Valid @NotNull ResetPassword resetPassword) {

    static final Duration DEFAULT_EXPIRY = Duration.ofDays(1);

    /** HS256 needs at least 256 bits of key material. */
    public record Auth(@NotBlank @Size(min = 32) String secret, Duration expiry) {
        public Auth {
            if (expiry == null || expiry.isZero() || expiry.isNegative()) {
                expiry = DEFAULT_EXPIRY;
            }
        }
    }

    public record Invitation(@NotBlank String secret) {}

    public record ResetPassword(@NotBlank String secret, Duration expiry) {
        public ResetPassword {
            if (expiry == null || expiry.isZero() || expiry.isNegative()) {
                expiry = DEFAULT_EXPIRY;
            }
        }
    }
}
