package com.ludora.paymentcore.util;

import com.ludora.paymentcore.entity.TransactionStatus;

import java.util.Locale;

/**
 * Maps provider status vocabulary onto {@link TransactionStatus}.
 *
 * The provider reports a textual status on webhooks ("success", "approved", "failed"...)
 * and a numeric status code on transaction data, where "000" means approved. Anything
 * not recognised as terminal maps to PENDING, so it never causes a transition.
 */
public final class ProviderStatusMapper {

    public static final String APPROVED_CODE = "000";

    private ProviderStatusMapper() {
    }

    /**
     * @param status     textual status from the webhook body, may be null
     * @param statusCode transaction status code, may be null
     */
    public static TransactionStatus fromWebhook(String status, String statusCode) {
        if (status != null && !status.isBlank()) {
            switch (status.trim().toLowerCase(Locale.ROOT)) {
                case "success":
                case "approved":
                case "completed":
                    return TransactionStatus.COMPLETED;
                case "failed":
                case "failure":
                case "declined":
                case "rejected":
                case "error":
                    return TransactionStatus.FAILED;
                case "cancelled":
                case "canceled":
                    return TransactionStatus.CANCELLED;
                default:
                    // pending / processing / initialized: fall back to the code, if any
                    break;
            }
        }
        return fromStatusCode(statusCode);
    }

    /**
     * "000" is approved; any other code on a transaction record is a decline.
     * A missing code means no payment attempt yet.
     */
    public static TransactionStatus fromStatusCode(String statusCode) {
        if (statusCode == null || statusCode.isBlank()) {
            return TransactionStatus.PENDING;
        }
        return APPROVED_CODE.equals(statusCode.trim()) ? TransactionStatus.COMPLETED : TransactionStatus.FAILED;
    }
}
