package com.ludora.paymentcore.service;

import com.ludora.paymentcore.client.PaymentProviderClient;
import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.ProviderResolution;
import com.ludora.paymentcore.dto.ProviderStatusResult;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.ResolutionMethod;
import com.ludora.paymentcore.entity.ResolutionOutcome;
import com.ludora.paymentcore.exception.ProviderUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback for lost or late webhooks: periodically asks the provider for the status of
 * pending transactions.
 *
 * Each attempt is counted (under the row lock) before the provider is called. A terminal
 * answer goes to {@link ResolutionArbiter} as POLLING. When the last allowed attempt
 * ends without a terminal answer the transaction is failed as ABANDONED_AFTER_POLLING and
 * an alert is raised.
 *
 * If the arbiter throws (a grant that cannot be written, a lock timeout) its work is
 * rolled back, the attempt is given back and an alert is raised; the transaction stays
 * PENDING and is picked up again by a later pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PollingReconciler {

    public enum PollResult {
        /** Not pending any more, or out of attempts. */
        SKIPPED,
        STILL_PENDING,
        /** Provider reported a terminal status and it was handed to the arbiter. */
        RESOLVED,
        PROVIDER_ERROR,
        ABANDONED,
        /** The arbiter threw; nothing was applied and the attempt was given back. */
        RESOLUTION_FAILED
    }

    private final TransactionStore store;
    private final PaymentProviderClient provider;
    private final ResolutionArbiter arbiter;
    private final AlertNotifier alerts;
    private final PaymentProperties props;
    private final Clock clock;

    /**
     * One reconciliation pass. Transactions are processed independently; a failure on one
     * is logged and the pass continues.
     */
    @Scheduled(fixedDelayString = "${payments.polling.interval:PT20S}",
            initialDelayString = "${payments.polling.interval:PT20S}")
    @SchedulerLock(name = "payment-polling-reconciler", lockAtMostFor = "PT5M")
    public void reconcile() {
        if (!props.getPolling().isEnabled()) {
            return;
        }
        List<PaymentTransaction> candidates = store.findPollCandidates(OffsetDateTime.now(clock));
        if (candidates.isEmpty()) {
            return;
        }

        Map<PollResult, Integer> summary = new LinkedHashMap<>();
        int errors = 0;
        for (PaymentTransaction txn : candidates) {
            try {
                summary.merge(pollNow(txn.getId()), 1, Integer::sum);
            } catch (RuntimeException e) {
                errors++;
                log.error("[POLLING] Poll failed. transactionId={}, pageRequestUid={}",
                        txn.getId(), txn.getPageRequestUid(), e);
            }
        }
        log.info("[POLLING] Pass finished. candidates={}, results={}, errors={}", candidates.size(), summary, errors);
    }

    /**
     * Performs a single polling attempt for one transaction.
     */
    public PollResult pollNow(Long transactionId) {
        PaymentTransaction txn = store.findById(transactionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction " + transactionId));

        MDC.put("transaction_id", String.valueOf(transactionId));
        MDC.put("page_request_uid", txn.getPageRequestUid());
        try {
            Optional<Integer> recorded = store.recordPollAttempt(transactionId, OffsetDateTime.now(clock));
            if (!recorded.isPresent()) {
                return PollResult.SKIPPED;
            }
            int attempt = recorded.get();
            int maxAttempts = props.getPolling().getMaxAttempts();

            ProviderStatusResult result;
            try {
                result = provider.lookupStatus(txn.getPageRequestUid());
            } catch (ProviderUnavailableException e) {
                log.warn("[POLLING] Provider lookup failed. transactionId={}, attempt={}/{}, reason={}",
                        transactionId, attempt, maxAttempts, e.getMessage());
                return attempt >= maxAttempts ? abandon(txn, attempt) : PollResult.PROVIDER_ERROR;
            }

            if (result.getStatus().isTerminal()) {
                ResolutionOutcome outcome;
                try {
                    outcome = arbiter.resolve(transactionId,
                            ProviderResolution.fromStatusLookup(result), ResolutionMethod.POLLING);
                } catch (RuntimeException e) {
                    return resolutionFailed(txn, attempt, result.getStatus().name(), e);
                }
                log.info("[POLLING] Terminal status. transactionId={}, attempt={}/{}, status={}, outcome={}",
                        transactionId, attempt, maxAttempts, result.getStatus(), outcome);
                return PollResult.RESOLVED;
            }

            if (attempt >= maxAttempts) {
                return abandon(txn, attempt);
            }
            log.debug("[POLLING] Still pending. transactionId={}, attempt={}/{}", transactionId, attempt, maxAttempts);
            return PollResult.STILL_PENDING;
        } finally {
            MDC.remove("transaction_id");
            MDC.remove("page_request_uid");
        }
    }

    private PollResult abandon(PaymentTransaction txn, int attempts) {
        ResolutionOutcome outcome;
        try {
            outcome = arbiter.resolve(txn.getId(), ProviderResolution.abandoned(attempts),
                    ResolutionMethod.ABANDONED_AFTER_POLLING);
        } catch (RuntimeException e) {
            return resolutionFailed(txn, attempts, "ABANDON", e);
        }
        log.warn("[POLLING] Abandoned. transactionId={}, attempts={}, outcome={}", txn.getId(), attempts, outcome);

        if (outcome == ResolutionOutcome.APPLIED) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("transactionId", txn.getId());
            context.put("pageRequestUid", txn.getPageRequestUid());
            context.put("paymentSessionId", txn.getPaymentSessionId());
            context.put("amountMinor", txn.getAmountMinor());
            context.put("attempts", attempts);
            alerts.alert(AlertNotifier.AlertType.POLLING_ABANDONED,
                    "Payment abandoned after " + attempts + " polling attempts", context);
        }
        return PollResult.ABANDONED;
    }

    private PollResult resolutionFailed(PaymentTransaction txn, int attempt, String reported, RuntimeException e) {
        log.error("[POLLING] Resolution failed, attempt given back. transactionId={}, attempt={}, reported={}",
                txn.getId(), attempt, reported, e);
        store.releasePollAttempt(txn.getId());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("transactionId", txn.getId());
        context.put("pageRequestUid", txn.getPageRequestUid());
        context.put("paymentSessionId", txn.getPaymentSessionId());
        context.put("reported", reported);
        context.put("attempt", attempt);
        context.put("error", e.getMessage() == null ? e.getClass().getName() : e.getMessage());
        alerts.alert(AlertNotifier.AlertType.RESOLUTION_FAILED,
                "Polling resolution rolled back for transaction " + txn.getId(), context);
        return PollResult.RESOLUTION_FAILED;
    }
}
