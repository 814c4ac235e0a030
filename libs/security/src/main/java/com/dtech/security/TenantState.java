package com.dtech.security;

/**
 * Subscription lifecycle state of a tenant.
 * <p>
 * States are written by billing and usage drivers outside this library. Authorization only
 * reads them, see {@link TenantStateGate}.
 */
public enum TenantState {

    /** Active subscription (EXTERNAL) or the initial state (INTERNAL). */
    NORMAL,

    /** Initial EXTERNAL state, and the state after a subscription is canceled. */
    SUBSCRIPTION_REQUIRED,

    /** EXTERNAL only: payment for the next billing period failed. */
    SUBSCRIPTION_RENEW_FAILED,

    /** Current users or targets exceed the tenant's limits. */
    LIMIT_EXCEEDED
}
