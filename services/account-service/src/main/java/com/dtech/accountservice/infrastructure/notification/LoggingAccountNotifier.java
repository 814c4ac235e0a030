package com.dtech.accountservice.infrastructure.notification;

import com.dtech.accountservice.domain.AccountNotifier;
import com.dtech.accountservice.domain.Vendor;
import com.dtech.observability.SensitiveDataRedactor;
import com.dtech.security.Identity;
import com.dtech.security.TenantRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AccountNotifier} that writes one INFO line per message. Token values in links are redacted.
 */
public class LoggingAccountNotifier implements AccountNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccountNotifier.class);

    private final SensitiveDataRedactor redactor;

    public LoggingAccountNotifier(SensitiveDataRedactor redactor) {
        this.redactor = redactor;
    }

    @Override
    public void userInvited(Identity user, Identity invitedBy, String invitationLink) {
        log.info("Invitation for user {} sent by {}: {}", user.id(), invitedBy.id(), redactor.redactLink(invitationLink));
    }

    @Override
    public void vendorUserInvited(Identity user, TenantRole role, Vendor vendor, Identity invitedBy, String link) {
        log.info("Invitation for user {} to vendor {} as {} sent by {}: {}",
                user.id(), vendor.id(), role, invitedBy.id(), redactor.redactLink(link));
    }

    @Override
    public void passwordResetRequested(Identity user, String resetLink) {
        log.info("Password reset link for user {}: {}", user.id(), redactor.redactLink(resetLink));
    }
}
