package com.dtech.accountservice.domain;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the front-end links carried by notifications.
 */
public final class AccountLinks {

    private final String appUrl;

    public AccountLinks(String appUrl) {
        if (appUrl == null || appUrl.isBlank()) {
            throw new IllegalArgumentException("appUrl must not be blank");
        }
        this.appUrl = appUrl;
    }

    public String acceptInvitation(String invitationToken) {
        return appUrl + "/accept-invitation?token=" + encode(invitationToken);
    }

    public String resetPassword(String resetToken) {
        return appUrl + "/reset-password?token=" + encode(resetToken);
    }

    public String vendor(String vendorId) {
        return appUrl + "/vendors/" + encode(vendorId);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
