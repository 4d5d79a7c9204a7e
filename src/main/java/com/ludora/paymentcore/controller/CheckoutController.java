package com.ludora.paymentcore.controller;

import com.ludora.paymentcore.config.RateLimiterService;
import com.ludora.paymentcore.dto.CreateSessionRequest;
import com.ludora.paymentcore.dto.ErrorResponse;
import com.ludora.paymentcore.dto.PaymentSessionResponse;
import com.ludora.paymentcore.service.PaymentSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;

/**
 * REST controller for checkout sessions.
 *
 * Endpoints:
 *  - POST /api/v1/payments/sessions                          open a checkout
 *  - GET  /api/v1/payments/sessions/{sessionRef}             session status
 *  - POST /api/v1/payments/sessions/{sessionRef}/status-check ask the provider now
 *
 * Callers authenticate with the API key (ApiKeyFilter) and pass the end user in X-User-Id.
 */
@RestController
@RequestMapping("/api/v1/payments/sessions")
@Validated
@RequiredArgsConstructor
public class CheckoutController {

    private final PaymentSessionManager sessionManager;
    private final RateLimiterService rateLimiterService;

    /**
     * Opens a checkout session.
     *
     * @return HTTP 201 with the session and its payment page URL,
     *         HTTP 429 if rate limit exceeded,
     *         HTTP 400/422/502 depending on validation, coupons and the provider.
     */
    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<?> createSession(
            @RequestHeader("X-User-Id") @NotBlank @Size(max = 64) String userId,
            @Valid @RequestBody CreateSessionRequest request,
            HttpServletRequest httpReq) {

        if (!rateLimiterService.tryConsumeCheckout()) {
            return tooManyRequests(httpReq);
        }

        PaymentSessionResponse resp = sessionManager.createSession(
                userId, request.getPurchaseIntents(), request.getCouponCodes(), request.getReturnUrl());
        return ResponseEntity.status(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body(resp);
    }

    @GetMapping(value = "/{sessionRef}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentSessionResponse> getSession(
            @RequestHeader("X-User-Id") @NotBlank String userId,
            @PathVariable String sessionRef) {
        return ResponseEntity.ok(sessionManager.getSession(userId, sessionRef));
    }

    @PostMapping(value = "/{sessionRef}/status-check", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> checkStatus(
            @RequestHeader("X-User-Id") @NotBlank String userId,
            @PathVariable String sessionRef,
            HttpServletRequest httpReq) {

        if (!rateLimiterService.tryConsumeCheckout()) {
            return tooManyRequests(httpReq);
        }
        return ResponseEntity.ok(sessionManager.requestStatusCheck(userId, sessionRef));
    }

    private static ResponseEntity<ErrorResponse> tooManyRequests(HttpServletRequest httpReq) {
        ErrorResponse error = ErrorResponse.builder()
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("Too Many Requests")
                .message("Too many requests - please try again later.")
                .path(httpReq.getRequestURI())
                .build();
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
    }
}
