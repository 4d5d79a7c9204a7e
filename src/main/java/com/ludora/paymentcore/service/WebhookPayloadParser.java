package com.ludora.paymentcore.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ludora.paymentcore.client.PayPlusPayloads;
import com.ludora.paymentcore.dto.ProviderNotification;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.exception.MalformedWebhookException;
import com.ludora.paymentcore.util.ProviderStatusMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a raw provider webhook body into a {@link ProviderNotification}.
 *
 * The correlation key is "page_request_uid", or "transaction.payment_page_request_uid"
 * on the transaction-shaped variant of the callback.
 */
@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

    private final ObjectMapper objectMapper;

    public ProviderNotification parse(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new MalformedWebhookException("Empty webhook body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookException("Webhook body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedWebhookException("Webhook body is not a JSON object");
        }

        String pageRequestUid = PayPlusPayloads.text(root, "page_request_uid", "transaction.payment_page_request_uid");
        if (pageRequestUid == null) {
            throw new MalformedWebhookException("Missing required page_request_uid in webhook data");
        }

        String statusName = PayPlusPayloads.text(root, "status", "transaction.status");
        String statusCode = PayPlusPayloads.text(root, "transaction.status_code", "status_code");
        TransactionStatus status = ProviderStatusMapper.fromWebhook(statusName, statusCode);

        return ProviderNotification.builder()
                .pageRequestUid(pageRequestUid)
                .providerTransactionUid(PayPlusPayloads.text(root, "transaction_uid", "transaction.uid"))
                .eventType(PayPlusPayloads.text(root, "transaction_type", "type", "status"))
                .statusCode(statusCode)
                .statusName(statusName)
                .statusDescription(PayPlusPayloads.text(root, "transaction.status_description",
                        "status_description", "reason"))
                .status(status)
                .paymentData(status == TransactionStatus.COMPLETED ? PayPlusPayloads.paymentData(root) : null)
                .build();
    }
}
