package com.dtech.security;

/**
 * A platform account, resolved from a credential before any authorization decision.
 *
 * @param id                 unique identity id (session token subject)
 * @param email              unique e-mail address (invitation and reset-password token subject)
 * @param firstName          optional first name
 * @param lastName           optional last name
 * @param role               global role
 * @param hashedPassword     password hash, {@code null} until the invitation is accepted
 * @param invitationAccepted whether the account has been activated
 */
public record Identity(
        String id,
        String email,
        String firstName,
        String lastName,
        Role role,
        String hashedPassword,
        boolean invitationAccepted
) {

    public Identity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /**
     * Creates a pending (not yet accepted) identity without profile or password.
     */
    public static Identity invited(String id, String email, Role role) {
        return new Identity(id, email, null, null, role, null, false);
    }

    public boolean hasPassword() {
        return hashedPassword != null && !hashedPassword.isEmpty();
    }

    public Identity withProfile(String firstName, String lastName) {
        return new Identity(id, email, firstName, lastName, role, hashedPassword, invitationAccepted);
    }

    public Identity withHashedPassword(String hashedPassword) {
        return new Identity(id, email, firstName, lastName, role, hashedPassword, invitationAccepted);
    }

    public Identity withInvitationAccepted(boolean invitationAccepted) {
        return new Identity(id, email, firstName, lastName, role, hashedPassword, invitationAccepted);
    }

    @Override
    public String toString() {
        return "Identity[id=%s, email=%s, role=%s, invitationAccepted=%s]"
                .formatted(id, email, role, invitationAccepted);
    }
}
