package com.dtech.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Session-token authorization pipeline for one {@link AuthorizationPolicy}.
 * <p>
 * Steps run strictly in order and the first failure is returned:
 * <ol>
 *   <li>bearer extraction and session token verification (UNAUTHORIZED)</li>
 *   <li>identity lookup by token subject (UNAUTHORIZED when the identity is gone)</li>
 *   <li>identity invitation accepted (FORBIDDEN)</li>
 *   <li>tenant invitation accepted, for VENDORs on tenant routes unless the policy allows
 *       pending tenant invitations (FORBIDDEN)</li>
 *   <li>global role (FORBIDDEN)</li>
 *   <li>tenant role, for VENDORs; memberships are loaded whenever the caller is a VENDOR
 *       (FORBIDDEN)</li>
 * </ol>
 * Instances are immutable and may be shared between concurrent requests.
 */
public final class RequestAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthorizer.class);

    private final SessionTokenVerifier tokenVerifier;
    private final IdentityStore identities;
    private final MembershipStore memberships;
    private final AuthorizationPolicy policy;

    public RequestAuthorizer(
            SessionTokenVerifier tokenVerifier,
            IdentityStore identities,
            MembershipStore memberships,
            AuthorizationPolicy policy) {
        if (tokenVerifier == null || identities == null || memberships == null || policy == null) {
            throw new SecurityMisconfigurationException("RequestAuthorizer collaborators must not be null");
        }
        this.tokenVerifier = tokenVerifier;
        this.identities = identities;
        this.memberships = memberships;
        this.policy = policy;
    }

    /**
     * Authorizes a request.
     *
     * @param authorizationHeader raw {@code Authorization} header value, may be null
     * @param tenantId            tenant id resolved from the route, or null for routes that are
     *                            not tenant-scoped
     */
    public AuthorizationOutcome authorize(String authorizationHeader, String tenantId) {
        Optional<String> token = BearerTokenExtractor.extract(authorizationHeader);
        if (token.isEmpty()) {
            return deny(AuthorizationFailure.unauthorized(AuthorizationFailure.TOKEN_REQUIRED));
        }

        SessionClaims claims;
        try {
            claims = tokenVerifier.verify(token.get());
        } catch (AuthorizationException e) {
            log.debug("Session token rejected: {}", e.getMessage());
            return deny(AuthorizationFailure.unauthorized(AuthorizationFailure.TOKEN_INVALID));
        }

        Optional<Identity> found = identities.findById(claims.userId());
        if (found.isEmpty()) {
            log.warn("Valid session token for unknown identity {}", claims.userId());
            return deny(AuthorizationFailure.unauthorized(AuthorizationFailure.TOKEN_INVALID));
        }
        Identity identity = found.get();

        if (!identity.invitationAccepted()) {
            return deny(AuthorizationFailure.forbidden(AuthorizationFailure.INVITATION_NOT_ACCEPTED));
        }

        boolean vendor = identity.role() == Role.VENDOR;
        if (vendor && tenantId != null && !policy.allowPendingTenantInvitation()) {
            boolean pending = memberships.find(tenantId, identity.id())
                    .map(membership -> !membership.invitationAccepted())
                    .orElse(false);
            if (pending) {
                return deny(AuthorizationFailure.forbidden(AuthorizationFailure.INVITATION_NOT_ACCEPTED));
            }
        }

        if (policy.restrictsGlobalRoles() && !policy.allowedGlobalRoles().contains(identity.role())) {
            log.debug("Identity {} with role {} not in {}", identity.id(), identity.role(), policy.allowedGlobalRoles());
            return deny(AuthorizationFailure.forbidden(AuthorizationFailure.RESOURCE_NOT_ALLOWED));
        }

        if (!vendor) {
            return AuthorizationOutcome.granted(AuthorizedContext.of(identity));
        }

        List<TenantMembership> userMemberships = memberships.listByUser(identity.id());
        if (policy.restrictsTenantRoles()
                && !MembershipRoleChecker.hasRole(
                        policy.allowedTenantRoles(), userMemberships, tenantId, identity.id())) {
            log.debug("Identity {} lacks tenant roles {} in tenant {}", identity.id(), policy.allowedTenantRoles(), tenantId);
            return deny(AuthorizationFailure.forbidden(AuthorizationFailure.RESOURCE_NOT_ALLOWED));
        }

        return AuthorizationOutcome.granted(new AuthorizedContext(identity, userMemberships));
    }

    public AuthorizationPolicy policy() {
        return policy;
    }

    private static AuthorizationOutcome deny(AuthorizationFailure failure) {
        return AuthorizationOutcome.denied(failure);
    }
}
