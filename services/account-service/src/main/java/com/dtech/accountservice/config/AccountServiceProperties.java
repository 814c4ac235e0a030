package com.dtech.accountservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service-level settings bound from {@code dtech.service.*}.
 *
 * <pre>
 * dtech:
 *   service:
 *     name: account-service
 *     environment: production
 *     app-url: https://app.dtech.com
 *     bootstrap-admin:
 *       email: root@dtech.com
 *       password: change-me
 * </pre>
 *
 * @param name           service name, used as the {@code service} metric tag
 * @param environment    deployment environment, defaults to {@code development}
 * @param appUrl         front-end base URL that invitation and reset links point to
 * @param bootstrapAdmin optional ADMIN created on startup when no identity has its e-mail
 */
@ConfigurationProperties(prefix = "dtech.service")
@Validated
public record AccountServiceProperties(
        @NotBlank String name, String environment, String appUrl, @Valid BootstrapAdmin bootstrapAdmin) {

    public AccountServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (appUrl == null || appUrl.isBlank()) {
            appUrl = "http://localhost:4200";
        }
        if (appUrl.endsWith("/")) {
            appUrl = appUrl.substring(0, appUrl.length() - 1);
        }
    }

    public record BootstrapAdmin(@NotBlank @Email String email, @NotBlank String password) {}
}
