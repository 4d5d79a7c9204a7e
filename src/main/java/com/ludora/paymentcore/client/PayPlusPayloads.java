package com.ludora.paymentcore.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ludora.paymentcore.dto.ProviderPaymentData;

/**
 * Field lookups shared by the webhook parser and the status lookup. The provider sends
 * the same information in slightly different places depending on the channel.
 */
public final class PayPlusPayloads {

    private PayPlusPayloads() {
    }

    /** First non-blank text among the given dotted paths, or null. */
    public static String text(JsonNode root, String... paths) {
        for (String path : paths) {
            JsonNode node = root;
            for (String part : path.split("\\.")) {
                node = node == null ? null : node.get(part);
            }
            if (node != null && !node.isNull() && !node.isContainerNode()) {
                String value = node.asText();
                if (!value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }

    public static Integer integer(JsonNode root, String... paths) {
        String value = text(root, paths);
        if (value == null) return null;
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Card token and card metadata, or null when the payload carries no token.
     *
     * @param root the transaction-level object (webhook body or the "data" of a status lookup)
     */
    public static ProviderPaymentData paymentData(JsonNode root) {
        if (root == null) return null;
        String token = text(root,
                "token_uid", "transaction.token_uid", "data.card_information.token",
                "card_information.token", "payment_method.token", "transaction.payment_method.token",
                "token", "transaction.token");
        if (token == null) return null;

        return ProviderPaymentData.builder()
                .token(token)
                .customerUid(text(root, "customer_uid", "data.customer_uid", "customer.customer_uid",
                        "transaction.customer_uid"))
                .cardLast4(text(root, "four_digits", "card_information.four_digits",
                        "data.card_information.four_digits", "transaction.four_digits", "card.last4"))
                .cardBrand(text(root, "brand_name", "card_information.brand_name",
                        "data.card_information.brand_name", "card.brand"))
                .expiryMonth(integer(root, "expiry_month", "card_information.expiry_month",
                        "data.card_information.expiry_month", "card.exp_month"))
                .expiryYear(integer(root, "expiry_year", "card_information.expiry_year",
                        "data.card_information.expiry_year", "card.exp_year"))
                .build();
    }
}
