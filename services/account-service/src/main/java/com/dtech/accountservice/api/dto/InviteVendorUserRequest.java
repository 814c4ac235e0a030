package com.dtech.accountservice.api.dto;

import com.dtech.security.TenantRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record InviteVendorUserRequest(
        @NotBlank @Email @Size(max = 255) String email, @NotNull TenantRole vendorRole) {}
