package com.ludora.paymentcore.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionRef) {
        super("Payment session not found: " + sessionRef);
    }
}
