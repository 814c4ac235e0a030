package com.dtech.accountservice.api;

import com.dtech.accountservice.api.dto.CreateVendorRequest;
import com.dtech.accountservice.api.dto.MemberVendorResponse;
import com.dtech.accountservice.api.dto.PageResponse;
import com.dtech.accountservice.api.dto.VendorResponse;
import com.dtech.accountservice.domain.InvitationFilter;
import com.dtech.accountservice.domain.VendorService;
import com.dtech.accountservice.infrastructure.security.Authorize;
import com.dtech.security.AuthorizedContext;
import com.dtech.security.Role;
import com.dtech.security.TenantRole;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/vendors")
public class VendorController {

    private final VendorService vendors;

    public VendorController(VendorService vendors) {
        this.vendors = vendors;
    }

    /**
     * ADMINs page through every vendor. VENDORs page through the vendors they belong to, optionally
     * only those with an {@code accepted} or a {@code pending} invitation.
     */
    @GetMapping
    @Authorize
    public PageResponse<?> list(
            AuthorizedContext caller,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "false") boolean accepted,
            @RequestParam(defaultValue = "false") boolean pending) {
        if (caller.role() == Role.ADMIN) {
            return PageResponse.of(vendors.listAll(offset, limit), VendorResponse::from);
        }
        InvitationFilter filter = InvitationFilter.of(accepted, pending);
        return PageResponse.of(
                vendors.listForMember(caller.memberships(), filter, offset, limit), MemberVendorResponse::from);
    }

    @PostMapping
    @Authorize(roles = Role.ADMIN)
    @ResponseStatus(HttpStatus.CREATED)
    public VendorResponse create(@Valid @RequestBody CreateVendorRequest request) {
        return VendorResponse.from(vendors.create(request.name(), request.userLimit()));
    }

    /** VENDORs see only vendors they are an accepted member of. */
    @GetMapping("/{vendorId}")
    @Authorize(
            roles = {Role.ADMIN, Role.VENDOR},
            tenantRoles = {TenantRole.ADMIN, TenantRole.ANALYST, TenantRole.VETTER})
    public VendorResponse get(@PathVariable String vendorId) {
        return VendorResponse.from(vendors.find(vendorId));
    }
}
