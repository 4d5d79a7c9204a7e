package com.ludora.paymentcore.service;

import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.dto.ProviderResolution;
import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.ResolutionMethod;
import com.ludora.paymentcore.entity.ResolutionOutcome;
import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.entity.TransactionStatusHistory;
import com.ludora.paymentcore.repository.PaymentSessionRepository;
import com.ludora.paymentcore.repository.PaymentTransactionRepository;
import com.ludora.paymentcore.repository.TransactionStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only writer of non-pending transaction statuses.
 *
 * Webhook ingestion, polling and manual actions all report outcomes here. Each call
 * locks the transaction row (SELECT ... FOR UPDATE) for the whole step, so of two
 * concurrent reports exactly one sees PENDING and applies; the other sees the terminal
 * status and becomes a DUPLICATE (same outcome) or is REJECTED (contradicting outcome).
 *
 * Steps, in one database transaction:
 *  1) lock the row
 *  2) classify against the current status
 *  3) write status, provider data and resolution method
 *  4) project the status onto the session
 *  5) apply side effects
 *  6) append a status history row, for every outcome
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResolutionArbiter {

    private final PaymentTransactionRepository txnRepo;
    private final PaymentSessionRepository sessionRepo;
    private final TransactionStatusHistoryRepository historyRepo;
    private final SideEffectApplier sideEffects;
    private final AlertNotifier alerts;
    private final PaymentProperties props;
    private final Clock clock;

    @Transactional
    public ResolutionOutcome resolve(Long transactionId, ProviderResolution resolution, ResolutionMethod source) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PaymentTransaction txn = txnRepo.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction " + transactionId));

        TransactionStatus current = txn.getStatus();
        TransactionStatus reported = resolution.getStatus();

        if (source == ResolutionMethod.WEBHOOK && txn.getWebhookReceivedAt() == null) {
            txn.setWebhookReceivedAt(now);
        }

        if (current.isTerminal()) {
            if (current == reported) {
                log.info("[ARBITER] Duplicate report. transactionId={}, status={}, source={}, resolvedBy={}",
                        transactionId, current, source, txn.getResolutionMethod());
                record(txn, current, reported, source, ResolutionOutcome.DUPLICATE,
                        "Already " + current + " via " + txn.getResolutionMethod(), now);
                return ResolutionOutcome.DUPLICATE;
            }
            boolean manualRefund = source == ResolutionMethod.MANUAL && current.canTransitionTo(reported);
            if (!manualRefund) {
                return reject(txn, reported, source, AlertNotifier.AlertType.CONFLICTING_OUTCOME,
                        "Reported " + reported + " but transaction is already " + current, now);
            }
        } else if (!current.canTransitionTo(reported)) {
            return reject(txn, reported, source, AlertNotifier.AlertType.ILLEGAL_TRANSITION,
                    "Illegal transition " + current + " -> " + reported, now);
        }

        PaymentSession session = sessionRepo.findById(txn.getPaymentSessionId())
                .orElseThrow(() -> new IllegalStateException("Session missing for transaction " + transactionId));

        if (reported == TransactionStatus.COMPLETED
                && props.getResolution().getExpiredSessionPolicy() == PaymentProperties.ExpiredSessionPolicy.REJECT
                && session.isExpiredAt(now)) {
            return reject(txn, reported, source, AlertNotifier.AlertType.LATE_COMPLETION_REJECTED,
                    "Completion arrived after session " + session.getSessionRef() + " expired", now);
        }

        applyStatus(txn, resolution, source, now);
        projectOntoSession(session, txn, now);
        sideEffects.apply(txn, session, resolution.getPaymentData());

        record(txn, current, reported, source, ResolutionOutcome.APPLIED, resolution.getFailureReason(), now);
        log.info("[ARBITER] Applied. transactionId={}, {} -> {}, source={}, sessionRef={}",
                transactionId, current, reported, source, session.getSessionRef());
        return ResolutionOutcome.APPLIED;
    }

    private void applyStatus(PaymentTransaction txn, ProviderResolution resolution,
                             ResolutionMethod source, OffsetDateTime now) {
        TransactionStatus reported = resolution.getStatus();
        txn.setStatus(reported);
        if (resolution.getRawResponse() != null) {
            txn.setProviderResponse(resolution.getRawResponse());
        }
        if (resolution.getProviderTransactionUid() != null) {
            txn.setProviderTransactionUid(resolution.getProviderTransactionUid());
        }
        // A refund keeps the method that originally resolved the payment.
        if (txn.getResolutionMethod() == null) {
            txn.setResolutionMethod(source);
        }
        switch (reported) {
            case COMPLETED:
                txn.setCompletedAt(now);
                break;
            case FAILED:
            case CANCELLED:
                txn.setFailedAt(now);
                txn.setFailureReason(resolution.getFailureReason());
                break;
            default:
                break;
        }
        txn.setNextPollAt(null);
        txnRepo.save(txn);
    }

    private void projectOntoSession(PaymentSession session, PaymentTransaction txn, OffsetDateTime now) {
        SessionStatus status = SessionStatus.fromTransaction(txn.getStatus());
        session.setSessionStatus(status);
        if (status == SessionStatus.COMPLETED && session.getCompletedAt() == null) {
            session.setCompletedAt(now);
        } else if (status == SessionStatus.FAILED || status == SessionStatus.CANCELLED) {
            session.setFailedAt(now);
            session.setErrorMessage(txn.getFailureReason());
        }
        sessionRepo.save(session);
    }

    private ResolutionOutcome reject(PaymentTransaction txn, TransactionStatus reported, ResolutionMethod source,
                                     AlertNotifier.AlertType alertType, String detail, OffsetDateTime now) {
        log.warn("[ARBITER] Rejected. transactionId={}, current={}, reported={}, source={}, detail={}",
                txn.getId(), txn.getStatus(), reported, source, detail);
        record(txn, txn.getStatus(), reported, source, ResolutionOutcome.REJECTED, detail, now);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("transactionId", txn.getId());
        context.put("pageRequestUid", txn.getPageRequestUid());
        context.put("currentStatus", txn.getStatus());
        context.put("reportedStatus", reported);
        context.put("source", source);
        alerts.alert(alertType, detail, context);
        return ResolutionOutcome.REJECTED;
    }

    private void record(PaymentTransaction txn, TransactionStatus from, TransactionStatus reported,
                        ResolutionMethod source, ResolutionOutcome outcome, String detail, OffsetDateTime now) {
        TransactionStatusHistory h = new TransactionStatusHistory();
        h.setTransactionId(txn.getId());
        h.setFromStatus(from);
        h.setReportedStatus(reported);
        h.setSource(source);
        h.setOutcome(outcome);
        h.setDetail(detail != null && detail.length() > 512 ? detail.substring(0, 512) : detail);
        h.setCreatedAt(now);
        historyRepo.save(h);
    }
}
