package com.ludora.paymentcore.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Transport details of a webhook delivery, captured for the forensic log.
 *
 * {@code headers} holds a whitelisted subset with credentials already redacted;
 * {@code signature} is the raw signature header and is never persisted.
 */
@Getter
@Builder
public class WebhookSenderInfo {
    private final String httpMethod;
    private final String senderIp;
    private final String userAgent;
    private final Map<String, String> headers;
    private final String signature;
}
