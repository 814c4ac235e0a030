package com.dtech.accountservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dtech.security.AuthorizationException;
import com.dtech.security.FailureKind;
import com.dtech.security.Identity;
import com.dtech.security.Role;
import com.dtech.security.TenantMembership;
import com.dtech.security.TenantRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UserAccountService")
class UserAccountServiceTest {

    private final AccountFixture fixture = new AccountFixture();
    private final UserAccountService accounts = fixture.accounts;

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("issues a session token that verifies to the identity")
        void issuesToken() {
            Identity admin = fixture.activeUser("root@dtech.test", Role.ADMIN, "secret-pw");

            String token = accounts.login(" ROOT@dtech.test ", "secret-pw");

            assertThat(fixture.sessions.verify(token).userId()).isEqualTo(admin.id());
        }

        @Test
        @DisplayName("rejects a wrong password, an unknown e-mail and a pending identity alike")
        void rejects() {
            fixture.activeUser("root@dtech.test", Role.ADMIN, "secret-pw");
            accounts.createIdentity("pending@dtech.test", Role.ADMIN);

            for (String[] credentials : new String[][] {
                {"root@dtech.test", "wrong"}, {"nobody@dtech.test", "secret-pw"}, {"pending@dtech.test", ""}
            }) {
                assertThatThrownBy(() -> accounts.login(credentials[0], credentials[1]))
                        .isInstanceOf(AuthorizationException.class)
                        .hasMessage(UserAccountService.INVALID_CREDENTIALS);
            }
        }
    }

    @Nested
    @DisplayName("invitations")
    class Invitations {

        @Test
        @DisplayName("inviting an ADMIN stores a pending identity and sends a verifiable link")
        void inviteAdmin() {
            Identity inviter = fixture.activeUser("root@dtech.test", Role.ADMIN, "pw");

            Identity invited = accounts.inviteAdmin("New@Dtech.test", inviter);

            assertThat(invited.email()).isEqualTo("new@dtech.test");
            assertThat(invited.invitationAccepted()).isFalse();
            var sent = fixture.notifier.last();
            assertThat(sent.link()).startsWith("http://app.test/accept-invitation?token=");
            assertThat(fixture.invitations.verify(AccountFixture.tokenOf(sent.link())).id()).isEqualTo(invited.id());
        }

        @Test
        @DisplayName("a taken e-mail is a conflict")
        void duplicateEmail() {
            Identity inviter = fixture.activeUser("root@dtech.test", Role.ADMIN, "pw");

            assertThatThrownBy(() -> accounts.inviteAdmin("root@dtech.test", inviter))
                    .isInstanceOf(ResourceConflictException.class);
        }

        @Test
        @DisplayName("an e-mail containing the token separator is refused before anything is stored")
        void separatorInEmail() {
            Identity inviter = fixture.activeUser("root@dtech.test", Role.ADMIN, "pw");

            assertThatThrownBy(() -> accounts.inviteAdmin("\"a:b\"@dtech.test", inviter))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessage(UserAccountService.EMAIL_WITH_SEPARATOR);
            assertThat(fixture.users.findByEmail("\"a:b\"@dtech.test")).isEmpty();
            assertThat(fixture.notifier.sent).isEmpty();
        }

        @Test
        @DisplayName("accepting sets profile and password and consumes the token")
        void accept() {
            Identity inviter = fixture.activeUser("root@dtech.test", Role.ADMIN, "pw");
            Identity invited = accounts.inviteAdmin("new@dtech.test", inviter);
            String token = AccountFixture.tokenOf(fixture.notifier.last().link());

            accounts.acceptInvitation(invited, " Ada ", "Lovelace", "new-password");

            Identity stored = accounts.findById(invited.id());
            assertThat(stored.invitationAccepted()).isTrue();
            assertThat(stored.firstName()).isEqualTo("Ada");
            assertThat(fixture.passwordEncoder.matches("new-password", stored.hashedPassword())).isTrue();
            assertThatThrownBy(() -> fixture.invitations.verify(token))
                    .isInstanceOfSatisfying(AuthorizationException.class,
                            e -> assertThat(e.kind()).isEqualTo(FailureKind.CONFLICT));
        }

        @Test
        @DisplayName("resending to an accepted identity is a conflict, to an unknown one not found")
        void resend() {
            Identity inviter = fixture.activeUser("root@dtech.test", Role.ADMIN, "pw");

            assertThatThrownBy(() -> accounts.resendInvitation(inviter.id(), inviter))
                    .isInstanceOf(ResourceConflictException.class);
            assertThatThrownBy(() -> accounts.resendInvitation("missing", inviter))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("passwords")
    class Passwords {

        @Test
        @DisplayName("change requires the current password")
        void change() {
            Identity user = fixture.activeUser("user@dtech.test", Role.ADMIN, "old-pw");

            assertThatThrownBy(() -> accounts.changePassword(user, "nope", "new-pw"))
                    .isInstanceOf(InvalidRequestException.class);

            accounts.changePassword(user, "old-pw", "new-pw");
            assertThat(accounts.login("user@dtech.test", "new-pw")).isNotBlank();
        }

        @Test
        @DisplayName("reset request sends a link carrying a valid reset token")
        void resetFlow() {
            Identity user = fixture.activeUser("user@dtech.test", Role.VENDOR, "old-pw");

            accounts.requestPasswordReset("USER@dtech.test");
            var sent = fixture.notifier.last();
            assertThat(sent.kind()).isEqualTo("password-reset");
            assertThat(fixture.resets.verify(AccountFixture.tokenOf(sent.link())).email()).isEqualTo(user.email());

            accounts.resetPassword(user, "fresh-pw");
            assertThat(accounts.login(user.email(), "fresh-pw")).isNotBlank();
        }

        @Test
        @DisplayName("reset request for an unknown e-mail is not found")
        void resetUnknown() {
            assertThatThrownBy(() -> accounts.requestPasswordReset("ghost@dtech.test"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("User with this email does not exist");
        }
    }

    @Test
    @DisplayName("deleting a user removes its memberships")
    void deleteCascades() {
        Identity vendorUser = fixture.activeUser("v@vendor.test", Role.VENDOR, "pw");
        fixture.memberships.save(new TenantMembership("t1", vendorUser.id(), TenantRole.ADMIN, true));

        accounts.deleteUser(vendorUser.id());

        assertThat(fixture.users.findById(vendorUser.id())).isEmpty();
        assertThat(fixture.memberships.listByUser(vendorUser.id())).isEmpty();
    }

    @Test
    @DisplayName("lists ADMINs only, ordered by e-mail")
    void listAdmins() {
        fixture.activeUser("b@dtech.test", Role.ADMIN, "pw");
        fixture.activeUser("a@dtech.test", Role.ADMIN, "pw");
        fixture.activeUser("v@vendor.test", Role.VENDOR, "pw");

        var page = accounts.listAdmins(0, 10);

        assertThat(page.total()).isEqualTo(2);
        assertThat(page.items()).extracting(Identity::email).containsExactly("a@dtech.test", "b@dtech.test");
    }
}
