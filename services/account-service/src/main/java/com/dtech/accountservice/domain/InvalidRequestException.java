package com.dtech.accountservice.domain;

import org.springframework.http.HttpStatus;

/** The request is well-formed but semantically wrong, e.g. an incorrect current password. */
public class InvalidRequestException extends AccountException {

    public InvalidRequestException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
