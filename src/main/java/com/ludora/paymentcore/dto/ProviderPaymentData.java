package com.ludora.paymentcore.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Card and customer details the provider reports with a completed payment.
 * Used to keep a token for recurring billing.
 */
@Getter
@Builder
@ToString(exclude = "token")
public class ProviderPaymentData {
    private final String customerUid;
    private final String token;
    private final String cardLast4;
    private final String cardBrand;
    private final Integer expiryMonth;
    private final Integer expiryYear;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
