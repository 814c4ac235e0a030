package com.dtech.accountservice.domain;

import org.springframework.http.HttpStatus;

/** The request collides with the current state, e.g. a duplicate e-mail or an invitation accepted twice. */
public class ResourceConflictException extends AccountException {

    public ResourceConflictException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.CONFLICT;
    }
}
