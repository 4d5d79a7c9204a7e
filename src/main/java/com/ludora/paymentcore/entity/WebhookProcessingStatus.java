package com.ludora.paymentcore.entity;

public enum WebhookProcessingStatus {
    PENDING,
    COMPLETED,
    FAILED
}
