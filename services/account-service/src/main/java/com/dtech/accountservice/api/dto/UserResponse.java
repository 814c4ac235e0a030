package com.dtech.accountservice.api.dto;

import com.dtech.security.Identity;
import com.dtech.security.Role;

/** Public view of an identity; never carries the password hash. */
public record UserResponse(
        String id, String email, String firstName, String lastName, Role role, boolean invitationAccepted) {

    public static UserResponse from(Identity identity) {
        return new UserResponse(
                identity.id(),
                identity.email(),
                identity.firstName(),
                identity.lastName(),
                identity.role(),
                identity.invitationAccepted());
    }
}
