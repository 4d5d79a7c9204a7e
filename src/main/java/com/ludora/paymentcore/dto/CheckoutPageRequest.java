package com.ludora.paymentcore.dto;

import lombok.Builder;
import lombok.Getter;

/**
 * Input for creating a hosted payment page at the provider.
 */
@Getter
@Builder
public class CheckoutPageRequest {
    private final String sessionRef;
    private final String userId;
    private final long amountMinor;
    private final String currency;
    private final String description;
    private final String callbackUrl;
    private final String successUrl;
    private final String failureUrl;
    private final String cancelUrl;
}
