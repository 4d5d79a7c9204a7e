package com.ludora.paymentcore.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;

/**
 * Request payload for opening a checkout session.
 */
@Getter
@Setter
public class CreateSessionRequest {

    /** One or more things to buy. A subscription must be bought on its own. */
    @NotEmpty(message = "purchaseIntents must not be empty")
    @Valid
    private List<PurchaseIntentRequest> purchaseIntents = new ArrayList<>();

    /** Optional coupon codes, applied in the given order. */
    private List<@Size(min = 1, max = 64) String> couponCodes = new ArrayList<>();

    /** Optional frontend URL to return to; defaults to the configured return URL. */
    @Size(max = 1024)
    private String returnUrl;
}
