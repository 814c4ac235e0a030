package com.dtech.accountservice.domain;

import com.dtech.security.Identity;
import com.dtech.security.TenantRole;

/**
 * Outbound port for the transactional messages of the account flows.
 */
public interface AccountNotifier {

    void userInvited(Identity user, Identity invitedBy, String invitationLink);

    void vendorUserInvited(Identity user, TenantRole role, Vendor vendor, Identity invitedBy, String link);

    void passwordResetRequested(Identity user, String resetLink);
}
