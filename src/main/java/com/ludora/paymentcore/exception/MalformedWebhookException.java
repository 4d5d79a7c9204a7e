package com.ludora.paymentcore.exception;

/**
 * Webhook body that cannot be parsed or carries no correlation key.
 * Recorded on the webhook log; never retried.
 */
public class MalformedWebhookException extends RuntimeException {

    public MalformedWebhookException(String message) {
        super(message);
    }

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
