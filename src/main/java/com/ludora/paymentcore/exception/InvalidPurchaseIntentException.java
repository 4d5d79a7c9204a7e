package com.ludora.paymentcore.exception;

import java.util.List;

/**
 * Thrown when a checkout request names something that cannot be bought: unknown or
 * inactive catalog items, duplicates, items already owned by the buyer, or a subscription
 * mixed with other purchases.
 */
public class InvalidPurchaseIntentException extends RuntimeException {

    /** Offending intents as "entityType:entityId", when known. */
    private final List<String> rejectedIntents;

    public InvalidPurchaseIntentException(String message) {
        this(message, List.of());
    }

    public InvalidPurchaseIntentException(String message, List<String> rejectedIntents) {
        super(message);
        this.rejectedIntents = rejectedIntents;
    }

    public List<String> getRejectedIntents() {
        return rejectedIntents;
    }
}
