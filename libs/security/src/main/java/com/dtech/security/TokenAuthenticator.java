package com.dtech.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates the two query-string credentials (invitation, reset password) into the same
 * {@link AuthorizationOutcome} the session pipeline produces.
 */
public final class TokenAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

    private final InvitationTokenCodec invitationCodec;
    private final ResetPasswordTokenCodec resetPasswordCodec;
    private final IdentityStore identities;

    public TokenAuthenticator(
            InvitationTokenCodec invitationCodec,
            ResetPasswordTokenCodec resetPasswordCodec,
            IdentityStore identities) {
        this.invitationCodec = invitationCodec;
        this.resetPasswordCodec = resetPasswordCodec;
        this.identities = identities;
    }

    /**
     * Authenticates an invitation token; the context carries the invited identity.
     */
    public AuthorizationOutcome authenticateInvitation(String token) {
        try {
            return AuthorizationOutcome.granted(AuthorizedContext.of(invitationCodec.verify(token)));
        } catch (AuthorizationException e) {
            log.debug("Invitation token rejected: {}", e.getMessage());
            return AuthorizationOutcome.denied(e.failure());
        }
    }

    /**
     * Authenticates a reset-password token and resolves its identity by e-mail.
     */
    public AuthorizationOutcome authenticateResetPassword(String token) {
        ResetPasswordClaims claims;
        try {
            claims = resetPasswordCodec.verify(token);
        } catch (AuthorizationException e) {
            log.debug("Reset-password token rejected: {}", e.getMessage());
            return AuthorizationOutcome.denied(e.failure());
        }
        return identities.findByEmail(claims.email())
                .map(identity -> AuthorizationOutcome.granted(AuthorizedContext.of(identity)))
                .orElseGet(() -> AuthorizationOutcome.denied(
                        AuthorizationFailure.notFound("User with this email does not exist")));
    }
}
