package com.dtech.accountservice.domain;

import org.springframework.http.HttpStatus;

/** A referenced user, vendor or membership does not exist. */
public class ResourceNotFoundException extends AccountException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.NOT_FOUND;
    }
}
