package com.ludora.paymentcore.entity;

/**
 * Lifecycle of a single payment attempt.
 *
 * Allowed edges:
 *  - PENDING   -> COMPLETED | FAILED | CANCELLED
 *  - COMPLETED -> REFUNDED (administrative only)
 *
 * Everything else is rejected.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED,
    REFUNDED;

    /** @return true for any status from which no automatic transition happens. */
    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(TransactionStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
                return target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED:
                return target == REFUNDED;
            default:
                return false;
        }
    }
}
