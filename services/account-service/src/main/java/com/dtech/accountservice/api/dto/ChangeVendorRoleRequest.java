package com.dtech.accountservice.api.dto;

import com.dtech.security.TenantRole;
import jakarta.validation.constraints.NotNull;

public record ChangeVendorRoleRequest(@NotNull TenantRole vendorRole) {}
