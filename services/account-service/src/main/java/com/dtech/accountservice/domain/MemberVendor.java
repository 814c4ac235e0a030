package com.dtech.accountservice.domain;

import com.dtech.security.TenantMembership;

/** A vendor seen through the caller's membership in it. */
public record MemberVendor(Vendor vendor, TenantMembership membership) {}
