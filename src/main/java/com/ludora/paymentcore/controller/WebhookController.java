package com.ludora.paymentcore.controller;

import com.ludora.paymentcore.config.RateLimiterService;
import com.ludora.paymentcore.dto.ErrorResponse;
import com.ludora.paymentcore.dto.WebhookReceipt;
import com.ludora.paymentcore.dto.WebhookSenderInfo;
import com.ludora.paymentcore.service.WebhookIngestor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider webhook endpoint.
 *
 * The body is taken as a raw string so the signature can be checked over the exact bytes
 * and the log keeps what was sent. Once the delivery is logged the answer is always 200,
 * whatever the processing result; the result is visible in the receipt and the log row.
 * Deliveries over the rate limit are logged as FAILED and answered 429.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "hash";

    /** Headers kept on the log row. */
    private static final List<String> LOGGED_HEADERS = List.of(
            "content-type", "content-length", "user-agent", "host",
            "x-forwarded-for", "x-real-ip", "x-forwarded-proto", "x-forwarded-host");

    /** Headers logged only as present / absent. */
    private static final List<String> REDACTED_HEADERS = List.of(SIGNATURE_HEADER, "authorization");

    private final WebhookIngestor ingestor;
    private final RateLimiterService rateLimiterService;

    @PostMapping(value = "/payplus", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> payplus(@RequestBody(required = false) String body, HttpServletRequest request) {
        String payload = body == null ? "" : body;
        WebhookSenderInfo sender = senderInfo(request);
        if (!rateLimiterService.tryConsumeWebhook()) {
            Long logId = ingestor.recordRejected(payload, sender, "Rate limited");
            log.warn("[WEBHOOK] Rate limit exceeded. senderIp={}, webhookLogId={}", sender.getSenderIp(), logId);
            ErrorResponse error = ErrorResponse.builder()
                    .status(HttpStatus.TOO_MANY_REQUESTS.value())
                    .error("Too Many Requests")
                    .message("Too many webhook deliveries - please retry later.")
                    .path(request.getRequestURI())
                    .build();
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
        }

        WebhookReceipt receipt = ingestor.receive(payload, sender);
        return ResponseEntity.ok(receipt);
    }

    private static WebhookSenderInfo senderInfo(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : LOGGED_HEADERS) {
            String value = request.getHeader(name);
            if (value != null) {
                headers.put(name, value);
            }
        }
        for (String name : REDACTED_HEADERS) {
            if (request.getHeader(name) != null) {
                headers.put(name, "[REDACTED]");
            }
        }

        return WebhookSenderInfo.builder()
                .httpMethod(request.getMethod())
                .senderIp(senderIp(request))
                .userAgent(request.getHeader("User-Agent"))
                .headers(headers)
                .signature(request.getHeader(SIGNATURE_HEADER))
                .build();
    }

    private static String senderIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
