package com.dtech.accountservice.api.dto;

import com.dtech.accountservice.domain.VendorMember;
import com.dtech.security.Role;
import com.dtech.security.TenantRole;

/**
 * A member of a vendor. {@code invitationAccepted} refers to the vendor invitation.
 */
public record VendorUserResponse(
        String id,
        String email,
        String firstName,
        String lastName,
        Role role,
        TenantRole vendorRole,
        boolean invitationAccepted) {

    public static VendorUserResponse from(VendorMember member) {
        return new VendorUserResponse(
                member.identity().id(),
                member.identity().email(),
                member.identity().firstName(),
                member.identity().lastName(),
                member.identity().role(),
                member.membership().role(),
                member.membership().invitationAccepted());
    }
}
