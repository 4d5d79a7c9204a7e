package com.ludora.paymentcore.entity;

/**
 * Channel that produced the final status of a transaction.
 */
public enum ResolutionMethod {
    WEBHOOK,
    POLLING,
    MANUAL,
    ABANDONED_AFTER_POLLING
}
