package com.ludora.paymentcore.dto;

import com.ludora.paymentcore.entity.TransactionStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * Parsed provider webhook. {@code status} is already mapped onto the transaction
 * state machine; PENDING means the provider reported a non-terminal state.
 */
@Getter
@Builder
public class ProviderNotification {
    private final String pageRequestUid;
    private final String providerTransactionUid;
    private final String eventType;
    private final String statusCode;
    private final String statusName;
    private final String statusDescription;
    private final TransactionStatus status;
    private final ProviderPaymentData paymentData;
}
