package com.dtech.accountservice.api;

import com.dtech.accountservice.api.dto.AcceptInvitationRequest;
import com.dtech.accountservice.api.dto.ChangePasswordRequest;
import com.dtech.accountservice.api.dto.CreateUserRequest;
import com.dtech.accountservice.api.dto.InvitationResponse;
import com.dtech.accountservice.api.dto.PageResponse;
import com.dtech.accountservice.api.dto.PasswordResetRequest;
import com.dtech.accountservice.api.dto.ResetPasswordRequest;
import com.dtech.accountservice.api.dto.UpdateProfileRequest;
import com.dtech.accountservice.api.dto.UserResponse;
import com.dtech.accountservice.domain.UserAccountService;
import com.dtech.accountservice.infrastructure.security.Authorize;
import com.dtech.accountservice.infrastructure.security.InvitationTokenRequired;
import com.dtech.accountservice.infrastructure.security.ResetPasswordTokenRequired;
import com.dtech.security.Identity;
import com.dtech.security.Role;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Platform users: the caller's own account, ADMIN management, invitation acceptance and password
 * reset.
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserAccountService accounts;

    public UserController(UserAccountService accounts) {
        this.accounts = accounts;
    }

    @GetMapping
    @Authorize(roles = Role.ADMIN)
    public PageResponse<UserResponse> listAdmins(
            @RequestParam(defaultValue = "0") int offset, @RequestParam(defaultValue = "10") int limit) {
        return PageResponse.of(accounts.listAdmins(offset, limit), UserResponse::from);
    }

    @GetMapping("/me")
    @Authorize
    public UserResponse me(Identity caller) {
        return UserResponse.from(caller);
    }

    @PutMapping("/me")
    @Authorize
    public UserResponse updateProfile(Identity caller, @Valid @RequestBody UpdateProfileRequest request) {
        return UserResponse.from(accounts.updateProfile(caller.id(), request.firstName(), request.lastName()));
    }

    @PutMapping("/me/password")
    @Authorize
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void changePassword(Identity caller, @Valid @RequestBody ChangePasswordRequest request) {
        accounts.changePassword(caller, request.currentPassword(), request.password());
    }

    @PostMapping
    @Authorize(roles = Role.ADMIN)
    public InvitationResponse inviteAdmin(Identity caller, @Valid @RequestBody CreateUserRequest request) {
        return InvitationResponse.from(accounts.inviteAdmin(request.email(), caller));
    }

    @PostMapping("/{userId}/resend-invitation")
    @Authorize(roles = Role.ADMIN)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resendInvitation(Identity caller, @PathVariable String userId) {
        accounts.resendInvitation(userId, caller);
    }

    @DeleteMapping("/{userId}")
    @Authorize(roles = Role.ADMIN)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String userId) {
        accounts.deleteUser(userId);
    }

    @GetMapping("/invitation")
    @InvitationTokenRequired
    public InvitationResponse invitation(Identity invitee) {
        return InvitationResponse.from(invitee);
    }

    @PostMapping("/accept-invitation")
    @InvitationTokenRequired
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void acceptInvitation(Identity invitee, @Valid @RequestBody AcceptInvitationRequest request) {
        accounts.acceptInvitation(invitee, request.firstName(), request.lastName(), request.password());
    }

    @PostMapping("/request-password-reset")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void requestPasswordReset(@Valid @RequestBody PasswordResetRequest request) {
        accounts.requestPasswordReset(request.email());
    }

    @PostMapping("/reset-password")
    @ResetPasswordTokenRequired
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resetPassword(Identity caller, @Valid @RequestBody ResetPasswordRequest request) {
        accounts.resetPassword(caller, request.password());
    }
}
