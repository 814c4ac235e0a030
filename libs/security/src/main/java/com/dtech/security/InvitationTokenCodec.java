package com.dtech.security;

/**
 * Stateless invitation tokens of the form {@code invitation:<email>:<digest>}.
 * <p>
 * The digest is an HMAC over {@link InvitationClaims} of the invited identity. Tokens carry no
 * expiry: a token stops verifying once its identity has accepted the invitation, which is the only
 * revocation mechanism. Verification recomputes the digest from the identity as currently stored,
 * so a change of role also invalidates outstanding tokens.
 */
public final class InvitationTokenCodec {

    static final String SEPARATOR = ":";
    static final String ALREADY_ACCEPTED = "Invitation already accepted";
    static final String TOKEN_NOT_VALID = "Token is not valid";

    private final ClaimSigner signer;
    private final IdentityStore identities;

    public InvitationTokenCodec(String secret, IdentityStore identities) {
        this.signer = new ClaimSigner(secret);
        this.identities = identities;
    }

    /**
     * Issues an invitation token for {@code identity}.
     *
     * @throws IllegalArgumentException if the e-mail contains the token separator
     */
    public String issue(Identity identity) {
        if (identity.email().contains(SEPARATOR)) {
            throw new IllegalArgumentException("email must not contain '" + SEPARATOR + "'");
        }
        String digest = signer.sign(InvitationClaims.of(identity));
        return String.join(SEPARATOR, ClaimType.INVITATION.value(), identity.email(), digest);
    }

    /**
     * Verifies {@code token} and returns the invited identity.
     *
     * @throws AuthorizationException {@link FailureKind#UNAUTHORIZED} when the token is malformed,
     *                                names an unknown e-mail or carries a wrong digest;
     *                                {@link FailureKind#CONFLICT} when the invitation was accepted
     */
    public Identity verify(String token) {
        if (token == null) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }
        String[] parts = token.split(SEPARATOR, -1);
        if (parts.length != 3 || !ClaimType.INVITATION.value().equals(parts[0])) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }
        String email = parts[1];
        String digest = parts[2];

        Identity identity = identities.findByEmail(email)
                .orElseThrow(() -> AuthorizationException.unauthorized(TOKEN_NOT_VALID));

        if (identity.invitationAccepted()) {
            throw new AuthorizationException(AuthorizationFailure.conflict(ALREADY_ACCEPTED));
        }
        if (!signer.verify(InvitationClaims.of(identity), digest)) {
            throw AuthorizationException.unauthorized(TOKEN_NOT_VALID);
        }
        return identity;
    }
}
