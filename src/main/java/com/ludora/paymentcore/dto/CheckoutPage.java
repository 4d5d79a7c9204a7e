package com.ludora.paymentcore.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Hosted payment page created by the provider. */
@Getter
@AllArgsConstructor
public class CheckoutPage {
    private final String pageRequestUid;
    private final String paymentPageUrl;
}
