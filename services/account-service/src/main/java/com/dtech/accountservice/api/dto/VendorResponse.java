package com.dtech.accountservice.api.dto;

import com.dtech.accountservice.domain.Vendor;
import com.dtech.security.TenantState;
import com.dtech.security.TenantType;

public record VendorResponse(String id, String name, TenantType type, TenantState state, int userLimit) {

    public static VendorResponse from(Vendor vendor) {
        return new VendorResponse(vendor.id(), vendor.name(), vendor.type(), vendor.state(), vendor.userLimit());
    }
}
