package com.ludora.paymentcore.service;

import com.ludora.paymentcore.config.PaymentProperties;
import com.ludora.paymentcore.entity.PaymentSession;
import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.SessionStatus;
import com.ludora.paymentcore.entity.TransactionStatus;
import com.ludora.paymentcore.repository.PaymentSessionRepository;
import com.ludora.paymentcore.repository.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations on payment transactions that need more than a repository call.
 *
 * Status changes are not made here: they go through {@link ResolutionArbiter}. This
 * class only creates transactions and keeps polling bookkeeping, each under the row lock
 * where it writes to an existing row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionStore {

    private static final List<SessionStatus> NOT_POLLED = List.of(SessionStatus.EXPIRED);

    private final PaymentTransactionRepository txnRepo;
    private final PaymentSessionRepository sessionRepo;
    private final PaymentProperties props;

    /**
     * Persists a new session and its pending transaction in one database transaction.
     */
    @Transactional
    public PaymentTransaction openCheckout(PaymentSession session, PaymentTransaction txn) {
        PaymentSession saved = sessionRepo.save(session);
        txn.setPaymentSessionId(saved.getId());
        PaymentTransaction created = txnRepo.save(txn);
        log.info("[SESSION] Checkout opened. sessionRef={}, transactionId={}, pageRequestUid={}, amountMinor={}",
                saved.getSessionRef(), created.getId(), created.getPageRequestUid(), created.getAmountMinor());
        return created;
    }

    public Optional<PaymentTransaction> findById(Long id) {
        return txnRepo.findById(id);
    }

    public Optional<PaymentTransaction> findByCorrelationKey(String pageRequestUid) {
        if (pageRequestUid == null) {
            return Optional.empty();
        }
        return txnRepo.findByPageRequestUid(pageRequestUid);
    }

    public Optional<PaymentTransaction> findLatestForSession(Long paymentSessionId) {
        return txnRepo.findFirstByPaymentSessionIdOrderByIdDesc(paymentSessionId);
    }

    /**
     * Pending transactions due for a status lookup, oldest first.
     */
    public List<PaymentTransaction> findPollCandidates(OffsetDateTime now) {
        PaymentProperties.Polling polling = props.getPolling();
        return txnRepo.findPollCandidates(
                TransactionStatus.PENDING,
                now.minus(polling.getGracePeriod()),
                polling.getMaxAttempts(),
                now,
                NOT_POLLED,
                PageRequest.of(0, polling.getBatchSize()));
    }

    /**
     * Counts one polling attempt before the provider is called, so a failing provider
     * call still uses up an attempt.
     *
     * @return the attempt number, or empty if the transaction is no longer pending or
     *         has no attempts left
     */
    @Transactional
    public Optional<Integer> recordPollAttempt(Long transactionId, OffsetDateTime now) {
        PaymentTransaction txn = txnRepo.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction " + transactionId));

        int maxAttempts = props.getPolling().getMaxAttempts();
        if (txn.getStatus() != TransactionStatus.PENDING || txn.getPollingAttempts() >= maxAttempts) {
            return Optional.empty();
        }

        int attempt = txn.getPollingAttempts() + 1;
        txn.setPollingAttempts(attempt);
        txn.setLastPolledAt(now);
        txn.setNextPollAt(now.plus(backoff(attempt)));
        return Optional.of(attempt);
    }

    /**
     * Gives back an attempt whose resolution rolled back, so the transaction stays
     * eligible for a later pass. The next-poll time set for the attempt is kept.
     */
    @Transactional
    public void releasePollAttempt(Long transactionId) {
        txnRepo.findByIdForUpdate(transactionId)
                .filter(txn -> txn.getStatus() == TransactionStatus.PENDING && txn.getPollingAttempts() > 0)
                .ifPresent(txn -> txn.setPollingAttempts(txn.getPollingAttempts() - 1));
    }

    /**
     * Records a non-terminal provider notification: first webhook time on the
     * transaction, and CREATED -> PENDING on the session.
     */
    @Transactional
    public void recordNonTerminalNotification(PaymentTransaction txn, OffsetDateTime now) {
        txnRepo.markWebhookReceived(txn.getId(), now);
        sessionRepo.markPending(txn.getPaymentSessionId(), now);
    }

    /**
     * Delay before the next attempt: initial * 2^(attempt-1), capped.
     */
    Duration backoff(int attempt) {
        Duration initial = props.getPolling().getInitialBackoff();
        Duration max = props.getPolling().getMaxBackoff();
        Duration delay = initial;
        for (int i = 1; i < attempt && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
