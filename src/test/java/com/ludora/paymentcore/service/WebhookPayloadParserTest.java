package com.ludora.paymentcore.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ludora.paymentcore.dto.ProviderNotification;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.exception.MalformedWebhookException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper());

    @Test
    void parse_flatCallback_withCardData() {
        ProviderNotification n = parser.parse("{\"page_request_uid\":\"uid-1\",\"transaction_uid\":\"ptx-1\","
                + "\"status\":\"approved\",\"status_code\":\"000\",\"transaction_type\":\"Charge\","
                + "\"token_uid\":\"tok-9\",\"customer_uid\":\"cust-1\",\"four_digits\":\"4242\","
                + "\"brand_name\":\"visa\",\"expiry_month\":\"12\",\"expiry_year\":\"28\"}");

        assertThat(n.getPageRequestUid()).isEqualTo("uid-1");
        assertThat(n.getProviderTransactionUid()).isEqualTo("ptx-1");
        assertThat(n.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(n.getEventType()).isEqualTo("Charge");
        assertThat(n.getPaymentData()).isNotNull();
        assertThat(n.getPaymentData().getToken()).isEqualTo("tok-9");
        assertThat(n.getPaymentData().getCustomerUid()).isEqualTo("cust-1");
        assertThat(n.getPaymentData().getCardLast4()).isEqualTo("4242");
        assertThat(n.getPaymentData().getExpiryMonth()).isEqualTo(12);
    }

    /**
     * Transaction-shaped variant: key and status code live under "transaction".
     */
    @Test
    void parse_transactionShapedCallback() {
        ProviderNotification n = parser.parse("{\"transaction\":{\"payment_page_request_uid\":\"uid-2\","
                + "\"uid\":\"ptx-2\",\"status_code\":\"051\",\"status_description\":\"Insufficient funds\"}}");

        assertThat(n.getPageRequestUid()).isEqualTo("uid-2");
        assertThat(n.getProviderTransactionUid()).isEqualTo("ptx-2");
        assertThat(n.getStatus()).isEqualTo(TransactionStatus.FAILED);
        assertThat(n.getStatusDescription()).isEqualTo("Insufficient funds");
        assertThat(n.getPaymentData()).isNull();
    }

    @Test
    void parse_rejectsEmptyNonObjectAndKeyless() {
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(MalformedWebhookException.class);
        assertThatThrownBy(() -> parser.parse("[1,2]")).isInstanceOf(MalformedWebhookException.class)
                .hasMessage("Webhook body is not a JSON object");
        assertThatThrownBy(() -> parser.parse("{\"status\":\"approved\"}"))
                .isInstanceOf(MalformedWebhookException.class)
                .hasMessageContaining("page_request_uid");
    }
}
