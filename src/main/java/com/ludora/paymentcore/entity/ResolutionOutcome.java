package com.ludora.paymentcore.entity;

/**
 * Result of one resolution attempt against a transaction.
 */
public enum ResolutionOutcome {
    /** The attempt moved the transaction and its side effects were applied. */
    APPLIED,
    /** The transaction already carried the reported status; nothing changed. */
    DUPLICATE,
    /** The reported status is not a legal transition; nothing changed. */
    REJECTED
}
