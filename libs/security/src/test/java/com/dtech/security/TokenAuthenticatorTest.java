package com.dtech.security;

import com.dtech.security.testing.InMemoryDirectory;
import com.dtech.security.testing.TestIdentities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TokenAuthenticator")
class TokenAuthenticatorTest {

    private final InMemoryDirectory directory = new InMemoryDirectory()
            .put(TestIdentities.pendingVendor("invitee"))
            .put(TestIdentities.vendor("member"));

    private final InvitationTokenCodec invitations = new InvitationTokenCodec("invitation-secret", directory);
    private final ResetPasswordTokenCodec resets =
            new ResetPasswordTokenCodec("reset-secret", Duration.ofHours(1), Clock.systemUTC());
    private final TokenAuthenticator authenticator = new TokenAuthenticator(invitations, resets, directory);

    @Test
    @DisplayName("invitation token grants a context for the invited identity")
    void invitationGranted() {
        var invitee = directory.findById("invitee").orElseThrow();

        var outcome = authenticator.authenticateInvitation(invitations.issue(invitee));

        assertThat(outcome.isGranted()).isTrue();
        assertThat(outcome.context().identity()).isEqualTo(invitee);
        assertThat(outcome.context().memberships()).isEmpty();
    }

    @Test
    @DisplayName("accepted invitation is denied with CONFLICT")
    void invitationConflict() {
        var invitee = directory.findById("invitee").orElseThrow();
        String token = invitations.issue(invitee);
        directory.put(invitee.withInvitationAccepted(true));

        assertThat(authenticator.authenticateInvitation(token).failure().kind()).isEqualTo(FailureKind.CONFLICT);
    }

    @Test
    @DisplayName("reset token resolves the identity by e-mail")
    void resetGranted() {
        var member = directory.findById("member").orElseThrow();

        var outcome = authenticator.authenticateResetPassword(resets.issue(member));

        assertThat(outcome.grantedContext()).hasValueSatisfying(
                context -> assertThat(context.userId()).isEqualTo("member"));
    }

    @Test
    @DisplayName("reset token of a deleted identity is denied with NOT_FOUND")
    void resetUnknownIdentity() {
        String token = resets.issue(directory.findById("member").orElseThrow());
        directory.removeIdentity("member");

        assertThat(authenticator.authenticateResetPassword(token).failure().kind()).isEqualTo(FailureKind.NOT_FOUND);
    }

    @Test
    @DisplayName("garbage reset token is denied with UNAUTHORIZED")
    void resetGarbage() {
        assertThat(authenticator.authenticateResetPassword("nope").failure().kind())
                .isEqualTo(FailureKind.UNAUTHORIZED);
    }
}
