package com.dtech.accountservice.api.dto;

import com.dtech.accountservice.domain.MemberVendor;
import com.dtech.security.TenantRole;
import com.dtech.security.TenantState;
import com.dtech.security.TenantType;

/**
 * A vendor as listed for one of its VENDOR members, with the member's role and invitation state.
 */
public record MemberVendorResponse(
        String id,
        String name,
        TenantType type,
        TenantState state,
        int userLimit,
        TenantRole vendorRole,
        boolean invitationAccepted) {

    public static MemberVendorResponse from(MemberVendor entry) {
        return new MemberVendorResponse(
                entry.vendor().id(),
                entry.vendor().name(),
                entry.vendor().type(),
                entry.vendor().state(),
                entry.vendor().userLimit(),
                entry.membership().role(),
                entry.membership().invitationAccepted());
    }
}
