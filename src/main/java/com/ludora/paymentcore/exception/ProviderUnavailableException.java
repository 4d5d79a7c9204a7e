package com.ludora.paymentcore.exception;

/**
 * The payment provider could not be reached or answered with an error.
 * Checkout creation surfaces it as 502; the polling loop treats it as transient.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
