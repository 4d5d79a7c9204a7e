package com.ludora.paymentcore.dto;

import com.ludora.paymentcore.entity.TransactionStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * A terminal outcome reported for a transaction, whatever channel it came from.
 */
@Getter
@Builder
public class ProviderResolution {
    private final TransactionStatus status;
    private final String providerTransactionUid;
    private final String rawResponse;
    private final String failureReason;
    private final ProviderPaymentData paymentData;

    public static ProviderResolution fromNotification(ProviderNotification notification, String rawPayload) {
        return ProviderResolution.builder()
                .status(notification.getStatus())
                .providerTransactionUid(notification.getProviderTransactionUid())
                .rawResponse(rawPayload)
                .failureReason(failureReason(notification.getStatus(), notification.getStatusCode(),
                        notification.getStatusDescription()))
                .paymentData(notification.getPaymentData())
                .build();
    }

    public static ProviderResolution fromStatusLookup(ProviderStatusResult result) {
        return ProviderResolution.builder()
                .status(result.getStatus())
                .providerTransactionUid(result.getProviderTransactionUid())
                .rawResponse(result.getRawResponse())
                .failureReason(failureReason(result.getStatus(), result.getStatusCode(),
                        result.getStatusDescription()))
                .paymentData(result.getPaymentData())
                .build();
    }

    /** FAILED outcome recorded when polling ran out of attempts without a provider answer. */
    public static ProviderResolution abandoned(int attempts) {
        return ProviderResolution.builder()
                .status(TransactionStatus.FAILED)
                .failureReason("Abandoned after " + attempts + " polling attempts")
                .build();
    }

    private static String failureReason(TransactionStatus status, String code, String description) {
        if (status != TransactionStatus.FAILED && status != TransactionStatus.CANCELLED) {
            return null;
        }
        if (description != null) {
            return description;
        }
        return code == null ? "Provider reported " + status.name().toLowerCase() : "Provider status code: " + code;
    }
}
