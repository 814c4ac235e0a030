package com.dtech.accountservice.api.dto;

import com.dtech.security.Identity;
import com.dtech.security.Role;

public record InvitationResponse(String id, String email, Role role, boolean invitationAccepted) {

    public static InvitationResponse from(Identity identity) {
        return new InvitationResponse(identity.id(), identity.email(), identity.role(), identity.invitationAccepted());
    }
}
