package com.dtech.accountservice.infrastructure.security;

import com.dtech.security.Role;
import com.dtech.security.TenantRole;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires a session token ({@code Authorization: Bearer ...}) that passes the authorization
 * pipeline with the given policy. Method-level annotations override class-level ones.
 *
 * <p>{@link #tenantRoles()} and {@link #allowPendingTenantInvitation()} refer to the vendor in the
 * {@code {vendorId}} path variable, which the mapping must then declare.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Authorize {

    /** Allowed global roles; empty lets any activated identity through. */
    Role[] roles() default {};

    /** Tenant roles a VENDOR must hold in the route's vendor; requires {@link Role#VENDOR} in {@link #roles()}. */
    TenantRole[] tenantRoles() default {};

    boolean allowPendingTenantInvitation() default false;
}
