package com.ludora.paymentcore.entity;

public enum SubscriptionStatus {
    PENDING,
    ACTIVE,
    PAYMENT_FAILED,
    CANCELLED
}
