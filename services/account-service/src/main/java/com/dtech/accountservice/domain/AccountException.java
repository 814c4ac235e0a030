package com.dtech.accountservice.domain;

import org.springframework.http.HttpStatus;

/**
 * Base of the business failures raised by the account services. Each subtype maps to one HTTP
 * status in the problem-detail response.
 */
public abstract class AccountException extends RuntimeException {

    protected AccountException(String message) {
        super(message);
    }

    public abstract HttpStatus status();
}
