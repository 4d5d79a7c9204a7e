package com.ludora.paymentcore.service;

import com.ludora.paymentcore.entity.PaymentTransaction;
import com.ludora.paymentcore.entity.Subscription;
import com.ludora.paymentcore.entity.SubscriptionStatus;
import com.ludora.paymentcore.exception.SideEffectException;
import com.ludora.paymentcore.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Subscription state changes driven by payment outcomes.
 *
 * Write methods only run inside the resolution step of {@link ResolutionArbiter}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepo;
    private final AlertNotifier alerts;
    private final Clock clock;

    /**
     * A subscription the user may pay for now: owned by the user and waiting for a payment.
     */
    public Optional<Subscription> findPayable(String userId, String subscriptionId) {
        return subscriptionRepo.findById(subscriptionId)
                .filter(s -> s.getUserId().equals(userId))
                .filter(s -> s.getStatus() == SubscriptionStatus.PENDING
                        || s.getStatus() == SubscriptionStatus.PAYMENT_FAILED);
    }

    /**
     * PENDING / PAYMENT_FAILED -> ACTIVE. An already active subscription is left alone.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void activate(String subscriptionId, PaymentTransaction txn) {
        Subscription sub = load(subscriptionId);

        switch (sub.getStatus()) {
            case ACTIVE:
                log.warn("[SUBSCRIPTION] Already active, activation skipped. subscriptionId={}, transactionId={}",
                        subscriptionId, txn.getId());
                return;
            case CANCELLED:
                alerts.alert(AlertNotifier.AlertType.SUBSCRIPTION_STATE_CONFLICT,
                        "Payment completed for a cancelled subscription",
                        Map.of("subscriptionId", subscriptionId, "transactionId", txn.getId()));
                return;
            default:
                break;
        }

        sub.setStatus(SubscriptionStatus.ACTIVE);
        sub.setActivatedAt(OffsetDateTime.now(clock));
        sub.setLastTransactionId(txn.getId());
        subscriptionRepo.save(sub);
        log.info("[SUBSCRIPTION] Activated. subscriptionId={}, transactionId={}", subscriptionId, txn.getId());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void handlePaymentFailure(String subscriptionId, PaymentTransaction txn) {
        Subscription sub = load(subscriptionId);
        sub.setFailedPaymentCount(sub.getFailedPaymentCount() + 1);
        sub.setLastPaymentFailedAt(OffsetDateTime.now(clock));
        sub.setLastTransactionId(txn.getId());
        if (sub.getStatus() == SubscriptionStatus.PENDING) {
            sub.setStatus(SubscriptionStatus.PAYMENT_FAILED);
        }
        subscriptionRepo.save(sub);
        log.info("[SUBSCRIPTION] Payment failed. subscriptionId={}, transactionId={}, failedPayments={}",
                subscriptionId, txn.getId(), sub.getFailedPaymentCount());
    }

    /**
     * The user abandoned the first payment of a subscription: a pending subscription is cancelled.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void handlePaymentCancelled(String subscriptionId, PaymentTransaction txn) {
        Subscription sub = load(subscriptionId);
        sub.setLastTransactionId(txn.getId());
        if (sub.getStatus() == SubscriptionStatus.PENDING) {
            sub.setStatus(SubscriptionStatus.CANCELLED);
        }
        subscriptionRepo.save(sub);
        log.info("[SUBSCRIPTION] Payment cancelled. subscriptionId={}, transactionId={}, status={}",
                subscriptionId, txn.getId(), sub.getStatus());
    }

    private Subscription load(String subscriptionId) {
        return subscriptionRepo.findById(subscriptionId)
                .orElseThrow(() -> new SideEffectException("Subscription not found: " + subscriptionId));
    }
}
