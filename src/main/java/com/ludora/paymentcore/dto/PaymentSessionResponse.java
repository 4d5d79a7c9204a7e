package com.ludora.paymentcore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ludora.paymentcore.entity.AppliedCoupon;
import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.PurchaseIntent;
import com.ludora.paymentcore.entity.ResolutionMethod;
import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.entity.TransactionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Client-safe view of a payment session and its current transaction.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentSessionResponse {

    private final String sessionRef;
    private final SessionStatus status;
    private final String paymentPageUrl;
    private final Long totalAmountMinor;
    private final Long originalAmountMinor;
    private final Long couponDiscountMinor;
    private final String currency;
    private final List<Item> items;
    private final List<String> coupons;
    private final OffsetDateTime expiresAt;
    private final OffsetDateTime completedAt;
    private final String errorMessage;

    private final TransactionStatus transactionStatus;
    private final ResolutionMethod resolutionMethod;

    @Getter
    @Builder
    public static class Item {
        private final String entityType;
        private final String entityId;
        private final Long amountMinor;
    }

    /**
     * @param txn may be null when checkout creation failed before a transaction existed
     */
    public static PaymentSessionResponse from(PaymentSession session, PaymentTransaction txn) {
        List<Item> items = session.getPurchaseIntents().stream()
                .map(PaymentSessionResponse::toItem)
                .collect(Collectors.toList());
        List<String> coupons = session.getAppliedCoupons().stream()
                .map(AppliedCoupon::getCode)
                .collect(Collectors.toList());

        return PaymentSessionResponse.builder()
                .sessionRef(session.getSessionRef())
                .status(session.getSessionStatus())
                .paymentPageUrl(session.getPaymentPageUrl())
                .totalAmountMinor(session.getTotalAmountMinor())
                .originalAmountMinor(session.getOriginalAmountMinor())
                .couponDiscountMinor(session.getCouponDiscountMinor())
                .currency(session.getCurrency())
                .items(items)
                .coupons(coupons.isEmpty() ? null : coupons)
                .expiresAt(session.getExpiresAt())
                .completedAt(session.getCompletedAt())
                .errorMessage(session.getErrorMessage())
                .transactionStatus(txn == null ? null : txn.getStatus())
                .resolutionMethod(txn == null ? null : txn.getResolutionMethod())
                .build();
    }

    private static Item toItem(PurchaseIntent intent) {
        return Item.builder()
                .entityType(intent.getEntityType())
                .entityId(intent.getEntityId())
                .amountMinor(intent.getAmountMinor())
                .build();
    }
}
