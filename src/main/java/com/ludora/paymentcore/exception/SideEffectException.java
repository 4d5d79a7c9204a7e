package com.ludora.paymentcore.exception;

/**
 * Failure while activating purchases or subscriptions for a resolved transaction.
 * Propagates out of the resolution step so the whole database transaction rolls back.
 */
public class SideEffectException extends RuntimeException {

    public SideEffectException(String message) {
        super(message);
    }

    public SideEffectException(String message, Throwable cause) {
        super(message, cause);
    }
}
