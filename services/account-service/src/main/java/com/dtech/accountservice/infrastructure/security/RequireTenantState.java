package com.dtech.accountservice.infrastructure.security;

import com.dtech.security.TenantState;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Rejects the request unless the vendor in the {@code {vendorId}} path variable is in one of
 * {@link #value()}. Evaluated after the credential check.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireTenantState {

    TenantState[] value() default {TenantState.NORMAL};
}
