package com.dtech.accountservice.domain;

import com.dtech.security.Identity;
import com.dtech.security.TenantMembership;

/** An identity seen through its membership in one vendor. */
public record VendorMember(Identity identity, TenantMembership membership) {}
