package com.dtech.accountservice.domain;

import com.dtech.security.AuthorizationException;
import com.dtech.security.Identity;
import com.dtech.security.InvitationTokenCodec;
import com.dtech.security.JwtSessionTokenService;
import com.dtech.security.ResetPasswordTokenCodec;
import com.dtech.security.Role;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Identity lifecycle: login, ADMIN invitations, profile and password changes, password reset and
 * deletion.
 */
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    static final String INVALID_CREDENTIALS = "Invalid e-mail or password";
    static final String EMAIL_WITH_SEPARATOR = "E-mail must not contain ':'";

    // separator of the invitation and reset-password token formats
    private static final String TOKEN_SEPARATOR = ":";

    private final UserRepository users;
    private final MembershipRepository memberships;
    private final PasswordEncoder passwordEncoder;
    private final JwtSessionTokenService sessionTokens;
    private final InvitationTokenCodec invitationTokens;
    private final ResetPasswordTokenCodec resetTokens;
    private final AccountNotifier notifier;
    private final AccountLinks links;

    public UserAccountService(
            UserRepository users,
            MembershipRepository memberships,
            PasswordEncoder passwordEncoder,
            JwtSessionTokenService sessionTokens,
            InvitationTokenCodec invitationTokens,
            ResetPasswordTokenCodec resetTokens,
            AccountNotifier notifier,
            AccountLinks links) {
        this.users = users;
        this.memberships = memberships;
        this.passwordEncoder = passwordEncoder;
        this.sessionTokens = sessionTokens;
        this.invitationTokens = invitationTokens;
        this.resetTokens = resetTokens;
        this.notifier = notifier;
        this.links = links;
    }

    /**
     * Exchanges credentials of an activated identity for a session token.
     *
     * @throws AuthorizationException UNAUTHORIZED on any mismatch
     */
    public String login(String email, String password) {
        Identity identity = users.findByEmail(normalize(email))
                .filter(Identity::invitationAccepted)
                .filter(Identity::hasPassword)
                .filter(candidate -> passwordEncoder.matches(password, candidate.hashedPassword()))
                .orElseThrow(() -> AuthorizationException.unauthorized(INVALID_CREDENTIALS));
        log.info("Issued session token for user {}", identity.id());
        return sessionTokens.issue(identity);
    }

    public Page<Identity> listAdmins(int offset, int limit) {
        return Page.slice(users.findAllByRole(Role.ADMIN), offset, limit);
    }

    public Identity findById(String userId) {
        return users.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User with this id does not exist"));
    }

    public Optional<Identity> lookupByEmail(String email) {
        return users.findByEmail(normalize(email));
    }

    public Identity findByEmail(String email) {
        return lookupByEmail(email)
                .orElseThrow(() -> new ResourceNotFoundException("User with this email does not exist"));
    }

    /**
     * Registers a pending identity.
     *
     * @throws InvalidRequestException  when the e-mail cannot be carried by a credential token
     * @throws ResourceConflictException when the e-mail is taken
     */
    public Identity createIdentity(String email, Role role) {
        String normalized = normalize(email);
        if (normalized == null || normalized.isEmpty() || normalized.contains(TOKEN_SEPARATOR)) {
            throw new InvalidRequestException(EMAIL_WITH_SEPARATOR);
        }
        if (users.findByEmail(normalized).isPresent()) {
            throw new ResourceConflictException("User with this email already exist");
        }
        Identity created = users.save(Identity.invited(UUID.randomUUID().toString(), normalized, role));
        log.info("Created {} user {}", role, created.id());
        return created;
    }

    public Identity inviteAdmin(String email, Identity invitedBy) {
        Identity admin = createIdentity(email, Role.ADMIN);
        sendInvitation(admin, invitedBy);
        return admin;
    }

    public void resendInvitation(String userId, Identity invitedBy) {
        sendInvitation(findById(userId), invitedBy);
    }

    public Identity updateProfile(String userId, String firstName, String lastName) {
        return users.save(findById(userId).withProfile(firstName.strip(), lastName.strip()));
    }

    public void changePassword(Identity identity, String currentPassword, String newPassword) {
        if (!identity.hasPassword() || !passwordEncoder.matches(currentPassword, identity.hashedPassword())) {
            throw new InvalidRequestException("Current password is incorrect");
        }
        setPassword(identity.id(), newPassword);
    }

    /**
     * Completes the invitation of {@code identity}; its invitation token stops verifying afterwards.
     */
    public void acceptInvitation(Identity identity, String firstName, String lastName, String password) {
        Identity accepted = findById(identity.id())
                .withProfile(firstName.strip(), lastName.strip())
                .withHashedPassword(passwordEncoder.encode(password))
                .withInvitationAccepted(true);
        users.save(accepted);
        log.info("User {} accepted the invitation", identity.id());
    }

    public void requestPasswordReset(String email) {
        Identity identity = findByEmail(email);
        notifier.passwordResetRequested(identity, links.resetPassword(resetTokens.issue(identity)));
        log.info("Password reset requested for user {}", identity.id());
    }

    public void resetPassword(Identity identity, String newPassword) {
        setPassword(identity.id(), newPassword);
        log.info("Password reset completed for user {}", identity.id());
    }

    /** Removes the identity and all of its vendor memberships. */
    public void deleteUser(String userId) {
        Identity identity = findById(userId);
        memberships.removeAllForUser(identity.id());
        users.delete(identity.id());
        log.info("Deleted user {}", identity.id());
    }

    private void setPassword(String userId, String newPassword) {
        users.save(findById(userId).withHashedPassword(passwordEncoder.encode(newPassword)));
    }

    private void sendInvitation(Identity user, Identity invitedBy) {
        if (user.invitationAccepted()) {
            throw new ResourceConflictException("User has already accepted the invitation");
        }
        notifier.userInvited(user, invitedBy, links.acceptInvitation(invitationTokens.issue(user)));
    }

    static String normalize(String email) {
        return email == null ? null : email.strip().toLowerCase(Locale.ROOT);
    }
}
