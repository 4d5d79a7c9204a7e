package com.ludora.paymentcore.exception;

import com.ludora.paymentcore.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

import javax.servlet.http.HttpServletRequest;
import javax.validation.ConstraintViolationException;
import java.util.List;

/**
 * Global exception handler for all controllers.
 * Ensures that API errors are consistently returned as {@link ErrorResponse}.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Unknown, inactive, duplicated or already-owned purchase intents.
     */
    @ExceptionHandler(InvalidPurchaseIntentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidIntent(
            InvalidPurchaseIntentException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getRejectedIntents(), req);
    }

    /**
     * Coupon codes that cannot be applied (business rule, not malformed input).
     */
    @ExceptionHandler(CouponRejectedException.class)
    public ResponseEntity<ErrorResponse> handleCouponRejected(
            CouponRejectedException ex, HttpServletRequest req) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getCodes(), req);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(
            SessionNotFoundException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null, req);
    }

    /**
     * Provider failures during checkout creation.
     */
    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProviderUnavailable(
            ProviderUnavailableException ex, HttpServletRequest req) {
        log.warn("[SESSION] Provider unavailable. path={}, reason={}", req.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), null, req);
    }

    /**
     * Handle missing required HTTP headers.
     * Example: missing `X-User-Id`.
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null, req);
    }

    /**
     * Handle validation errors from @Valid request body.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBodyValidation(
            MethodArgumentNotValidException ex, HttpServletRequest req) {

        String msg = ex.getBindingResult()
                .getAllErrors()
                .get(0)
                .getDefaultMessage();

        return build(HttpStatus.BAD_REQUEST, msg, null, req);
    }

    /**
     * Handle validation errors from @Validated method parameters.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null, req);
    }

    /**
     * Handle explicit ResponseStatusException thrown inside services or controllers.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(
            ResponseStatusException ex, HttpServletRequest req) {
        return build(ex.getStatus(), ex.getReason(), null, req);
    }

    /**
     * Catch-all handler for unexpected exceptions.
     * Prevents leaking stack traces to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(
            Exception ex, HttpServletRequest req) {
        log.error("[API] Unhandled error. path={}", req.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected server error", null, req);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message,
                                                       List<String> details, HttpServletRequest req) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(req.getRequestURI())
                .build();

        return ResponseEntity.status(status).body(body);
    }
}
