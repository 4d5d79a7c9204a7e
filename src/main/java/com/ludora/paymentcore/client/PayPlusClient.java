package com.ludora.paymentcore.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.CheckoutPage;
import com.ludora.paymentcore.dto.CheckoutPageRequest;
import com.ludora.paymentcore.dto.ProviderStatusResult;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.exception.ProviderUnavailableException;
import com.ludora.paymentcore.util.ProviderStatusMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PayPlus REST client.
 *
 * Endpoints:
 *  - PaymentPages/generateLink : hosted payment page, returns page_request_uid + payment_page_link
 *  - Transactions/PaymentData  : transaction data of a payment page by page_request_uid
 *
 * Authentication is by "api-key" / "secret-key" headers. Amounts are sent in major units.
 */
@Component
@Slf4j
public class PayPlusClient implements PaymentProviderClient {

    static final int CHARGE_METHOD_IMMEDIATE = 1;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PaymentProperties props;

    public PayPlusClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                         ObjectMapper objectMapper,
                         PaymentProperties props) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public String name() {
        return "payplus";
    }

    @Override
    public CheckoutPage createPaymentPage(CheckoutPageRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payment_page_uid", props.getProvider().getPaymentPageUid());
        body.put("charge_method", CHARGE_METHOD_IMMEDIATE);
        body.put("amount", BigDecimal.valueOf(request.getAmountMinor()).movePointLeft(2));
        body.put("currency_code", request.getCurrency());
        body.put("create_token", true);
        body.put("refURL_success", request.getSuccessUrl());
        body.put("refURL_failure", request.getFailureUrl());
        body.put("refURL_cancel", request.getCancelUrl());
        body.put("refURL_callback", request.getCallbackUrl());
        body.put("more_info", request.getSessionRef());
        body.put("more_info_1", request.getUserId());
        if (request.getDescription() != null) {
            body.put("more_info_2", request.getDescription());
        }

        JsonNode root = post("PaymentPages/generateLink", body);
        if (!isSuccess(root)) {
            String message = PayPlusPayloads.text(root, "results.description", "results.message");
            log.error("[PROVIDER] generateLink rejected. sessionRef={}, reason={}", request.getSessionRef(), message);
            throw new ProviderUnavailableException("Payment provider rejected checkout creation: " + message);
        }

        String pageRequestUid = PayPlusPayloads.text(root, "data.page_request_uid");
        String link = PayPlusPayloads.text(root, "data.payment_page_link");
        if (pageRequestUid == null || link == null) {
            throw new ProviderUnavailableException("Payment provider response is missing page_request_uid or payment_page_link");
        }

        log.info("[PROVIDER] Payment page created. sessionRef={}, pageRequestUid={}", request.getSessionRef(), pageRequestUid);
        return new CheckoutPage(pageRequestUid, link);
    }

    @Override
    public ProviderStatusResult lookupStatus(String pageRequestUid) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page_request_uid", pageRequestUid);

        JsonNode root = post("Transactions/PaymentData", body);
        String raw = root.toString();

        // An error answer for a page with no payment attempt is "not paid yet", not a failure.
        if (!isSuccess(root)) {
            log.debug("[PROVIDER] Status lookup returned no transaction. pageRequestUid={}", pageRequestUid);
            return ProviderStatusResult.builder()
                    .status(TransactionStatus.PENDING)
                    .rawResponse(raw)
                    .build();
        }

        // No transaction data means the page exists but nobody paid on it yet.
        JsonNode data = root.path("data");
        JsonNode transaction = data.get("transaction");
        if (transaction == null || transaction.isNull()) {
            return ProviderStatusResult.builder()
                    .status(TransactionStatus.PENDING)
                    .rawResponse(raw)
                    .build();
        }

        String statusCode = PayPlusPayloads.text(transaction, "status_code");
        TransactionStatus status = ProviderStatusMapper.fromStatusCode(statusCode);

        return ProviderStatusResult.builder()
                .status(status)
                .statusCode(statusCode)
                .statusDescription(PayPlusPayloads.text(transaction, "status_description", "reason"))
                .providerTransactionUid(PayPlusPayloads.text(transaction, "uid", "transaction_uid"))
                .rawResponse(raw)
                .paymentData(status == TransactionStatus.COMPLETED ? PayPlusPayloads.paymentData(data) : null)
                .build();
    }

    private JsonNode post(String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("api-key", props.getProvider().getApiKey());
        headers.set("secret-key", props.getProvider().getSecretKey());

        String url = props.getProvider().getBaseUrl() + path;
        String response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Payment provider call failed: " + path, e);
        }
        if (response == null || response.isBlank()) {
            throw new ProviderUnavailableException("Payment provider returned an empty body: " + path);
        }
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException("Payment provider returned invalid JSON: " + path, e);
        }
    }

    private static boolean isSuccess(JsonNode root) {
        return "success".equalsIgnoreCase(PayPlusPayloads.text(root, "results.status"));
    }
}
