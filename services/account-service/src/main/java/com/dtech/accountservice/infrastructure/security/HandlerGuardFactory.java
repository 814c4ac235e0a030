package com.dtech.accountservice.infrastructure.security;

import com.dtech.security.AuthorizationPolicy;
import com.dtech.security.AuthorizedContext;
import com.dtech.security.Identity;
import com.dtech.security.IdentityStore;
import com.dtech.security.MembershipStore;
import com.dtech.security.RequestAuthorizer;
import com.dtech.security.Role;
import com.dtech.security.SecurityMisconfigurationException;
import com.dtech.security.SessionTokenVerifier;
import com.dtech.security.TenantRole;
import com.dtech.security.TenantState;
import com.dtech.security.TenantStateGate;
import com.dtech.security.TenantStore;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.core.annotation.AnnotatedElementUtils;

/**
 * Turns the security annotations of a handler method into a {@link HandlerGuard}.
 *
 * <p>Every inconsistency (two credential annotations, a tenant check on a route without
 * {@code {vendorId}}, a context parameter on a public route, an invalid policy) is a
 * {@link SecurityMisconfigurationException}.
 */
class HandlerGuardFactory {

    static final String VENDOR_ID = "vendorId";

    private final SessionTokenVerifier sessionTokens;
    private final IdentityStore identities;
    private final MembershipStore memberships;
    private final TenantStore tenants;

    HandlerGuardFactory(
            SessionTokenVerifier sessionTokens,
            IdentityStore identities,
            MembershipStore memberships,
            TenantStore tenants) {
        this.sessionTokens = sessionTokens;
        this.identities = identities;
        this.memberships = memberships;
        this.tenants = tenants;
    }

    HandlerGuard create(Method method, Class<?> beanType, Collection<String> patterns) {
        String handler = beanType.getSimpleName() + "#" + method.getName();
        Authorize authorize = findAuthorize(method, beanType);
        boolean invitation = AnnotatedElementUtils.hasAnnotation(method, InvitationTokenRequired.class);
        boolean reset = AnnotatedElementUtils.hasAnnotation(method, ResetPasswordTokenRequired.class);

        List<HandlerGuard.Credential> credentials = new ArrayList<>();
        if (authorize != null) {
            credentials.add(HandlerGuard.Credential.SESSION);
        }
        if (invitation) {
            credentials.add(HandlerGuard.Credential.INVITATION_TOKEN);
        }
        if (reset) {
            credentials.add(HandlerGuard.Credential.RESET_PASSWORD_TOKEN);
        }
        if (credentials.size() > 1) {
            throw new SecurityMisconfigurationException(handler + " declares several credentials: " + credentials);
        }
        HandlerGuard.Credential credential = credentials.isEmpty() ? HandlerGuard.Credential.NONE : credentials.get(0);

        if (credential == HandlerGuard.Credential.NONE && takesCallerArgument(method)) {
            throw new SecurityMisconfigurationException(handler + " needs the caller but declares no credential");
        }

        RequestAuthorizer authorizer = null;
        if (authorize != null) {
            AuthorizationPolicy policy = new AuthorizationPolicy(
                    toSet(authorize.roles(), Role.class),
                    toSet(authorize.tenantRoles(), TenantRole.class),
                    authorize.allowPendingTenantInvitation());
            if ((policy.restrictsTenantRoles() || policy.allowPendingTenantInvitation()) && !hasVendorId(patterns)) {
                throw new SecurityMisconfigurationException(handler + " checks tenant membership without {vendorId}");
            }
            authorizer = new RequestAuthorizer(sessionTokens, identities, memberships, policy);
        }

        TenantStateGate stateGate = null;
        RequireTenantState requiredState = AnnotatedElementUtils.findMergedAnnotation(method, RequireTenantState.class);
        if (requiredState != null) {
            if (!hasVendorId(patterns)) {
                throw new SecurityMisconfigurationException(handler + " checks the vendor state without {vendorId}");
            }
            stateGate = new TenantStateGate(tenants, toSet(requiredState.value(), TenantState.class));
        }

        if (credential == HandlerGuard.Credential.NONE && stateGate == null) {
            return HandlerGuard.PUBLIC;
        }
        return new HandlerGuard(credential, authorizer, stateGate);
    }

    private static Authorize findAuthorize(Method method, Class<?> beanType) {
        Authorize onMethod = AnnotatedElementUtils.findMergedAnnotation(method, Authorize.class);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(beanType, Authorize.class);
    }

    private static boolean takesCallerArgument(Method method) {
        return Arrays.stream(method.getParameterTypes())
                .anyMatch(type -> type == AuthorizedContext.class || type == Identity.class);
    }

    private static boolean hasVendorId(Collection<String> patterns) {
        return !patterns.isEmpty() && patterns.stream().allMatch(pattern -> pattern.contains("{" + VENDOR_ID + "}"));
    }

    private static <E extends Enum<E>> Set<E> toSet(E[] values, Class<E> type) {
        Set<E> set = EnumSet.noneOf(type);
        set.addAll(Arrays.asList(values));
        return set;
    }
}
