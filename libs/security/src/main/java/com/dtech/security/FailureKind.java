package com.dtech.security;

/**
 * Categories of request rejection. Each maps to one HTTP status.
 */
public enum FailureKind {

    /** Missing, malformed, invalid or expired credential. The caller should re-authenticate. */
    UNAUTHORIZED(401),

    /** Valid credential, but insufficient privilege or an unmet invitation/tenant-state precondition. */
    FORBIDDEN(403),

    /** A referenced identity or tenant does not exist. */
    NOT_FOUND(404),

    /** Structurally valid but stale credential, e.g. an invitation that was already accepted. */
    CONFLICT(409);

    private final int httpStatus;

    FailureKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
