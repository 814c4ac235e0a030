package com.dtech.security;

/**
 * Thrown by credential codecs and verifiers when a credential is rejected.
 * <p>
 * Request pipelines convert it into an {@link AuthorizationOutcome}; callers that use the
 * codecs directly may let it propagate to their error handler.
 */
public class AuthorizationException extends RuntimeException {

    private final AuthorizationFailure failure;

    public AuthorizationException(AuthorizationFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public AuthorizationException(AuthorizationFailure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public static AuthorizationException unauthorized(String message) {
        return new AuthorizationException(AuthorizationFailure.unauthorized(message));
    }

    public AuthorizationFailure failure() {
        return failure;
    }

    public FailureKind kind() {
        return failure.kind();
    }
}
