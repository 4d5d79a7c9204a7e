package com.ludora.paymentcore.dto;

import com.ludora.paymentcore.entity.WebhookProcessingStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Acknowledgement returned to the provider. {@code received} is always true once the
 * delivery has been logged; processingStatus may still be PENDING if processing
 * outlived the response deadline.
 */
@Getter
@AllArgsConstructor
public class WebhookReceipt {
    private final boolean received;
    private final Long webhookLogId;
    private final WebhookProcessingStatus processingStatus;
}
