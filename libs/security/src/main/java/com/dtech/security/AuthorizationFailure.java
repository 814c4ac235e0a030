package com.dtech.security;

/**
 * A typed, terminal rejection of a request.
 *
 * @param kind    rejection category
 * @param message client-safe description (never contains token material)
 */
public record AuthorizationFailure(FailureKind kind, String message) {

    public static final String TOKEN_REQUIRED = "Token required";
    public static final String TOKEN_INVALID = "This token is unauthorized";
    public static final String INVITATION_NOT_ACCEPTED = "Invitation not accepted yet";
    public static final String RESOURCE_NOT_ALLOWED = "You are not allowed to access this resource";
    public static final String PLAN_STATUS_NOT_ALLOWED = "Your plan status does not allow this action";

    public static AuthorizationFailure unauthorized(String message) {
        return new AuthorizationFailure(FailureKind.UNAUTHORIZED, message);
    }

    public static AuthorizationFailure forbidden(String message) {
        return new AuthorizationFailure(FailureKind.FORBIDDEN, message);
    }

    public static AuthorizationFailure notFound(String message) {
        return new AuthorizationFailure(FailureKind.NOT_FOUND, message);
    }

    public static AuthorizationFailure conflict(String message) {
        return new AuthorizationFailure(FailureKind.CONFLICT, message);
    }
}
