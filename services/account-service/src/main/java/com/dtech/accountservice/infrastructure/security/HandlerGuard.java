package com.dtech.accountservice.infrastructure.security;

import com.dtech.security.RequestAuthorizer;
import com.dtech.security.TenantStateGate;

/**
 * What the interceptor checks before one handler method runs.
 *
 * @param credential  how the caller authenticates
 * @param authorizer  session pipeline, set only for {@link Credential#SESSION}
 * @param stateGate   vendor state check, or null when the handler has no {@link RequireTenantState}
 */
record HandlerGuard(Credential credential, RequestAuthorizer authorizer, TenantStateGate stateGate) {

    static final HandlerGuard PUBLIC = new HandlerGuard(Credential.NONE, null, null);

    enum Credential {
        NONE,
        SESSION,
        INVITATION_TOKEN,
        RESET_PASSWORD_TOKEN
    }
}
