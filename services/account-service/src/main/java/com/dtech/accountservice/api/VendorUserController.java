package com.dtech.accountservice.api;

import com.dtech.accountservice.api.dto.ChangeVendorRoleRequest;
import com.dtech.accountservice.api.dto.InviteVendorUserRequest;
import com.dtech.accountservice.api.dto.VendorUserResponse;
import com.dtech.accountservice.api.dto.VendorUsersResponse;
import com.dtech.accountservice.domain.Page;
import com.dtech.accountservice.domain.VendorMember;
import com.dtech.accountservice.domain.VendorMembershipService;
import com.dtech.accountservice.domain.VendorService;
import com.dtech.accountservice.infrastructure.security.Authorize;
import com.dtech.accountservice.infrastructure.security.RequireTenantState;
import com.dtech.security.Identity;
import com.dtech.security.Role;
import com.dtech.security.TenantRole;
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
 * Members of one vendor. Management routes are open to ADMINs and to VENDORs holding the tenant
 * ADMIN role in the vendor.
 */
@RestController
@RequestMapping("/api/v1/vendors/{vendorId}")
public class VendorUserController {

    private final VendorMembershipService memberships;
    private final VendorService vendors;

    public VendorUserController(VendorMembershipService memberships, VendorService vendors) {
        this.memberships = memberships;
        this.vendors = vendors;
    }

    @GetMapping("/users")
    @Authorize(roles = {Role.ADMIN, Role.VENDOR}, tenantRoles = TenantRole.ADMIN)
    public VendorUsersResponse list(
            @PathVariable String vendorId,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "10") int limit) {
        Page<VendorMember> page = memberships.listMembers(vendorId, offset, limit);
        return new VendorUsersResponse(
                page.total(),
                vendors.find(vendorId).userLimit(),
                page.items().stream().map(VendorUserResponse::from).toList());
    }

    @PostMapping("/users")
    @Authorize(roles = {Role.ADMIN, Role.VENDOR}, tenantRoles = TenantRole.ADMIN)
    @RequireTenantState
    public VendorUserResponse invite(
            Identity caller, @PathVariable String vendorId, @Valid @RequestBody InviteVendorUserRequest request) {
        return VendorUserResponse.from(memberships.invite(vendorId, request.email(), request.vendorRole(), caller));
    }

    @PostMapping("/users/{userId}/resend-invitation")
    @Authorize(roles = {Role.ADMIN, Role.VENDOR}, tenantRoles = TenantRole.ADMIN)
    @RequireTenantState
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resendInvitation(Identity caller, @PathVariable String vendorId, @PathVariable String userId) {
        memberships.resendInvitation(vendorId, userId, caller);
    }

    @PostMapping("/accept-invitation")
    @Authorize(roles = Role.VENDOR, allowPendingTenantInvitation = true)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void acceptInvitation(Identity caller, @PathVariable String vendorId) {
        memberships.acceptInvitation(vendorId, caller.id());
    }

    @PutMapping("/users/{userId}")
    @Authorize(roles = {Role.ADMIN, Role.VENDOR}, tenantRoles = TenantRole.ADMIN)
    public VendorUserResponse changeRole(
            @PathVariable String vendorId,
            @PathVariable String userId,
            @Valid @RequestBody ChangeVendorRoleRequest request) {
        return VendorUserResponse.from(memberships.changeRole(vendorId, userId, request.vendorRole()));
    }

    @DeleteMapping("/users/{userId}")
    @Authorize(roles = {Role.ADMIN, Role.VENDOR}, tenantRoles = TenantRole.ADMIN)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(@PathVariable String vendorId, @PathVariable String userId) {
        memberships.remove(vendorId, userId);
    }
}
