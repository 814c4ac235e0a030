package com.dtech.accountservice.domain;

import org.springframework.http.HttpStatus;

/** The vendor has reached a limit of its plan. */
public class PaymentRequiredException extends AccountException {

    public PaymentRequiredException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.PAYMENT_REQUIRED;
    }
}
