package com.ludora.paymentcore.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;

/**
 * One item of a checkout request. The price is never taken from the client.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseIntentRequest {

    /** e.g. "course", "workshop", "file", "subscription" */
    @NotBlank
    @Size(max = 32)
    private String entityType;

    @NotBlank
    @Size(max = 64)
    private String entityId;
}
