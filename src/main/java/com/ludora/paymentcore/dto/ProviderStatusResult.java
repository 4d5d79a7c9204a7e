package com.ludora.paymentcore.dto;

import com.ludora.paymentcore.entity.TransactionStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * Answer of a provider status lookup. PENDING means no terminal outcome yet, including
 * the case where the user has not attempted a payment on the page.
 */
@Getter
@Builder
public class ProviderStatusResult {
    private final TransactionStatus status;
    private final String statusCode;
    private final String statusDescription;
    private final String providerTransactionUid;
    private final String rawResponse;
    private final ProviderPaymentData paymentData;
}
