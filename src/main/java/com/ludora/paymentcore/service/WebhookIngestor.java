package com.ludora.paymentcore.service;

import com.ludora.paymentcore.client.PaymentProviderClient;
import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.ProviderNotification;
import com.ludora.paymentcore.dto.ProviderResolution;
import com.ludora.paymentcore.dto.WebhookReceipt;
import com.ludora.paymentcore.dto.WebhookSenderInfo;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.ResolutionMethod;
import com.ludora.paymentcore.entity.ResolutionOutcome;
import com.ludora.paymentcore.entity.WebhookLog;
import com.ludora.paymentcore.entity.WebhookProcessingStatus;
import com.ludora.paymentcore.exception.MalformedWebhookException;
import com.ludora.paymentcore.util.WebhookSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for provider webhooks.
 *
 * Order of steps:
 *   1) write the WebhookLog row (own transaction) - nothing else happens before this
 *   2) verify the signature
 *   3) parse the body and find the transaction by its correlation key
 *   4) non-terminal status: note it, no transition
 *   5) terminal status: hand it to {@link ResolutionArbiter} as WEBHOOK
 *   6) write outcome, error and duration back onto the log row
 *
 * Steps 2-6 run on the webhook executor. The caller waits at most the configured
 * processing timeout, then acknowledges while processing carries on. Per-delivery errors
 * end up on the log row and never reach the caller.
 */
@Service
@Slf4j
public class WebhookIngestor {

    private static final String MDC_LOG_ID = "webhook_log_id";
    private static final String MDC_PAGE_REQUEST_UID = "page_request_uid";
    private static final String MDC_TRANSACTION_ID = "transaction_id";

    private final WebhookLogService logService;
    private final WebhookPayloadParser parser;
    private final WebhookSignatureVerifier signatureVerifier;
    private final TransactionStore store;
    private final ResolutionArbiter arbiter;
    private final PaymentProviderClient provider;
    private final AsyncTaskExecutor executor;
    private final PaymentProperties props;
    private final Clock clock;

    public WebhookIngestor(WebhookLogService logService,
                           WebhookPayloadParser parser,
                           WebhookSignatureVerifier signatureVerifier,
                           TransactionStore store,
                           ResolutionArbiter arbiter,
                           PaymentProviderClient provider,
                           @Qualifier("webhookExecutor") AsyncTaskExecutor executor,
                           PaymentProperties props,
                           Clock clock) {
        this.logService = logService;
        this.parser = parser;
        this.signatureVerifier = signatureVerifier;
        this.store = store;
        this.arbiter = arbiter;
        this.provider = provider;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Logs and processes one delivery.
     *
     * @throws RuntimeException only if the log row itself cannot be written; the provider
     *                          will then retry the delivery
     */
    public WebhookReceipt receive(String rawPayload, WebhookSenderInfo sender) {
        WebhookLog row = logService.open(provider.name(), rawPayload, sender);
        Long logId = row.getId();
        MDC.put(MDC_LOG_ID, String.valueOf(logId));
        try {
            log.info("[WEBHOOK] Received. webhookLogId={}, senderIp={}, userAgent={}",
                    logId, sender.getSenderIp(), sender.getUserAgent());

            Future<WebhookProcessingStatus> future;
            try {
                future = executor.submit(() -> process(row, rawPayload, sender));
            } catch (TaskRejectedException e) {
                log.warn("[WEBHOOK] Processing queue full, left to polling. webhookLogId={}", logId);
                fail(row, "Webhook processing queue full", e);
                return new WebhookReceipt(true, logId, WebhookProcessingStatus.FAILED);
            }

            long timeoutMs = props.getWebhook().getProcessingTimeout().toMillis();
            try {
                return new WebhookReceipt(true, logId, future.get(timeoutMs, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                log.warn("[WEBHOOK] Processing still running after {} ms, acknowledging. webhookLogId={}",
                        timeoutMs, logId);
                return new WebhookReceipt(true, logId, WebhookProcessingStatus.PENDING);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new WebhookReceipt(true, logId, WebhookProcessingStatus.PENDING);
            } catch (ExecutionException e) {
                log.error("[WEBHOOK] Processing crashed. webhookLogId={}", logId, e.getCause());
                return new WebhookReceipt(true, logId, WebhookProcessingStatus.FAILED);
            }
        } finally {
            MDC.remove(MDC_LOG_ID);
        }
    }

    /**
     * Logs a delivery that is turned away before processing (rate limit). The row is
     * written FAILED straight away; the provider is expected to redeliver.
     *
     * @return id of the log row
     */
    public Long recordRejected(String rawPayload, WebhookSenderInfo sender, String reason) {
        WebhookLog row = logService.open(provider.name(), rawPayload, sender);
        fail(row, reason, null);
        log.warn("[WEBHOOK] Rejected before processing. webhookLogId={}, senderIp={}, reason={}",
                row.getId(), sender.getSenderIp(), reason);
        return row.getId();
    }

    WebhookProcessingStatus process(WebhookLog row, String rawPayload, WebhookSenderInfo sender) {
        MDC.put(MDC_LOG_ID, String.valueOf(row.getId()));
        try {
            if (signatureVerifier.isEnforced() && !signatureVerifier.verify(rawPayload, sender.getSignature())) {
                log.warn("[WEBHOOK] Invalid signature. webhookLogId={}, senderIp={}", row.getId(), sender.getSenderIp());
                return fail(row, "Invalid webhook signature", null);
            }
            row.addProcessLog(now(), signatureVerifier.isEnforced() ? "Signature verified" : "Signature check disabled");

            ProviderNotification notification;
            try {
                notification = parser.parse(rawPayload);
            } catch (MalformedWebhookException e) {
                log.warn("[WEBHOOK] Malformed payload. webhookLogId={}, reason={}", row.getId(), e.getMessage());
                return fail(row, e.getMessage(), e);
            }

            String key = notification.getPageRequestUid();
            MDC.put(MDC_PAGE_REQUEST_UID, key);
            row.setRetryCount((int) logService.countEarlierDeliveries(key, notification.getProviderTransactionUid()));
            row.setPageRequestUid(key);
            row.setProviderTransactionUid(notification.getProviderTransactionUid());
            row.setEventType(notification.getEventType());
            row.setProviderStatusCode(notification.getStatusCode());
            row.setProviderStatusName(notification.getStatusName());
            row.addProcessLog(now(), "Parsed: pageRequestUid=" + key + ", status=" + notification.getStatusName()
                    + ", statusCode=" + notification.getStatusCode() + ", mapped=" + notification.getStatus()
                    + (row.getRetryCount() > 0 ? ", retry=" + row.getRetryCount() : ""));

            Optional<PaymentTransaction> found = store.findByCorrelationKey(key);
            if (!found.isPresent()) {
                log.warn("[WEBHOOK] No transaction found. pageRequestUid={}", key);
                return fail(row, "No transaction found for " + key, null);
            }

            PaymentTransaction txn = found.get();
            MDC.put(MDC_TRANSACTION_ID, String.valueOf(txn.getId()));
            row.setTransactionId(txn.getId());
            row.setPaymentSessionId(txn.getPaymentSessionId());
            row.addProcessLog(now(), "Found transaction " + txn.getId() + " (" + txn.getStatus() + ")");

            if (!notification.getStatus().isTerminal()) {
                store.recordNonTerminalNotification(txn, now());
                row.addProcessLog(now(), "Non-terminal status, no transition");
                log.info("[WEBHOOK] Non-terminal status. transactionId={}, status={}",
                        txn.getId(), notification.getStatusName());
                return finish(row, WebhookProcessingStatus.COMPLETED);
            }

            ResolutionOutcome outcome = arbiter.resolve(txn.getId(),
                    ProviderResolution.fromNotification(notification, rawPayload), ResolutionMethod.WEBHOOK);
            row.addProcessLog(now(), "Resolution " + outcome + " for status " + notification.getStatus());
            log.info("[WEBHOOK] Processed. transactionId={}, status={}, outcome={}",
                    txn.getId(), notification.getStatus(), outcome);
            return finish(row, WebhookProcessingStatus.COMPLETED);

        } catch (RuntimeException e) {
            log.error("[WEBHOOK] Processing failed. webhookLogId={}", row.getId(), e);
            return fail(row, e.getMessage() == null ? e.getClass().getName() : e.getMessage(), e);
        } finally {
            MDC.remove(MDC_LOG_ID);
            MDC.remove(MDC_PAGE_REQUEST_UID);
            MDC.remove(MDC_TRANSACTION_ID);
        }
    }

    private WebhookProcessingStatus finish(WebhookLog row, WebhookProcessingStatus status) {
        row.finish(status, now());
        logService.update(row);
        return status;
    }

    private WebhookProcessingStatus fail(WebhookLog row, String message, Throwable error) {
        row.setErrorMessage(WebhookLogService.truncate(message, 1024));
        if (error != null) {
            row.setErrorStack(stackTrace(error));
        }
        row.addProcessLog(now(), "Failed: " + message);
        return finish(row, WebhookProcessingStatus.FAILED);
    }

    private static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
