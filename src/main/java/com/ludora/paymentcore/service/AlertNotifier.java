package com.ludora.paymentcore.service;

import java.util.Map;

/**
 * Hand-off point for conditions that need a human: abandoned payments, contradicting
 * provider reports, payments that arrived too late to be granted, or a resolution that
 * keeps rolling back.
 */
public interface AlertNotifier {

    enum AlertType {
        POLLING_ABANDONED,
        ILLEGAL_TRANSITION,
        CONFLICTING_OUTCOME,
        LATE_COMPLETION_REJECTED,
        SUBSCRIPTION_STATE_CONFLICT,
        RESOLUTION_FAILED
    }

    void alert(AlertType type, String message, Map<String, Object> context);
}
