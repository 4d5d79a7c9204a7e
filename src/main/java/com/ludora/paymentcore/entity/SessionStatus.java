package com.ludora.paymentcore.entity;

/**
 * Coarse checkout status shown to the user. Projection of the transaction status plus expiry.
 */
public enum SessionStatus {
    CREATED,
    PENDING,
    COMPLETED,
    FAILED,
    EXPIRED,
    CANCELLED;

    /** @return true while the session still waits for a provider outcome. */
    public boolean isOpen() {
        return this == CREATED || this == PENDING;
    }

    /** Maps a terminal transaction status onto the session. */
    public static SessionStatus fromTransaction(TransactionStatus status) {
        switch (status) {
            case COMPLETED:
            case REFUNDED:
                return COMPLETED;
            case FAILED:
                return FAILED;
            case CANCELLED:
                return CANCELLED;
            default:
                return PENDING;
        }
    }
}
